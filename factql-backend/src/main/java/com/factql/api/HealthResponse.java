package com.factql.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthResponse {
    public static final String STATUS_OK = "ok";
    public static final String STATUS_UNHEALTHY = "unhealthy";

    private String status;
    private String error;

    public static HealthResponse ok() {
        return HealthResponse.builder().status(STATUS_OK).build();
    }

    public static HealthResponse unhealthy(String error) {
        return HealthResponse.builder().status(STATUS_UNHEALTHY).error(error).build();
    }

    @JsonIgnore
    public boolean isHealthy() {
        return STATUS_OK.equals(status);
    }
}

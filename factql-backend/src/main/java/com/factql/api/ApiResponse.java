package com.factql.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Envelope shared by every data endpoint: {@code {data, count}} on success and
 * {@code {error}} on failure.
 *
 * @param <T> element type of {@code data}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private List<T> data;
    private Integer count;
    private String error;

    public static <T> ApiResponse<T> of(List<T> data) {
        return ApiResponse.<T>builder()
                .data(data)
                .count(data.size())
                .build();
    }

    public static ApiResponse<Void> error(String message) {
        return ApiResponse.<Void>builder()
                .error(message)
                .build();
    }
}

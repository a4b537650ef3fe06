package com.factql.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Request body of {@code POST /api/facts/aggregate}.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QueryRequest {
    private String dateFrom;
    private String dateTo;
    private List<String> eventTypes;
    private List<BigInteger> userIds;
    private List<String> groupBy;
    private List<String> metrics;

    // Accepted on the wire but not applied to the query yet.
    private Map<String, String> filters;

    private Integer limit;

    @Min(value = 0, message = "offset must not be negative")
    private Integer offset;
}

package com.factql.query;

import lombok.Builder;
import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Aggregate request that passed {@link RequestValidator}: every group-by column and metric is
 * whitelisted, metrics are non-empty and limit/offset are clamped.
 */
@Data
@Builder
public class ValidatedRequest {
    private LocalDate dateFrom;
    private LocalDate dateTo;
    private List<String> eventTypes;
    private List<BigInteger> userIds;
    private List<String> groupBy;
    private List<Metric> metrics;
    private Map<String, String> filters;
    private int limit;
    private int offset;
}

package com.factql.query;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * Normalized time-series request. Both dates are always present.
 *
 * <p>{@code metric} is kept as the client sent it: unknown names are resolved to a default by
 * {@link QueryBuilder}, not rejected.
 */
@Data
@Builder
public class TimeseriesQuery {
    private LocalDate dateFrom;
    private LocalDate dateTo;
    private String eventType;
    private String metric;
    private Granularity granularity;
}

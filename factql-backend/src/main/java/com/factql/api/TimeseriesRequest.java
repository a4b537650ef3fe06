package com.factql.api;

import lombok.Builder;
import lombok.Data;

/**
 * Query parameters of {@code GET /api/facts/timeseries}.
 */
@Data
@Builder
public class TimeseriesRequest {
    private String dateFrom;
    private String dateTo;
    private String eventType;
    private String metric;
    private String granularity;
}

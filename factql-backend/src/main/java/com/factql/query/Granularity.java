package com.factql.query;

import java.util.Arrays;

/**
 * Time-bucketing resolution for the time-series endpoint.
 */
public enum Granularity {
    DAY("day", "event_date"),
    HOUR("hour", "toStartOfHour(event_time)"),
    WEEK("week", "toMonday(event_date)"),
    MONTH("month", "toStartOfMonth(event_date)");

    private final String param;
    private final String bucketExpression;

    Granularity(String param, String bucketExpression) {
        this.param = param;
        this.bucketExpression = bucketExpression;
    }

    public String getBucketExpression() {
        return bucketExpression;
    }

    /**
     * Resolves a request parameter. Missing or unknown values fall back to {@link #DAY}.
     *
     * @param param raw granularity parameter, may be null
     * @return granularity, never null
     */
    public static Granularity fromParam(String param) {
        if (param == null || param.isBlank()) {
            return DAY;
        }
        return Arrays.stream(values())
                .filter(g -> g.param.equals(param))
                .findFirst()
                .orElse(DAY);
    }
}

package com.factql.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * One row of the fact table as returned by {@code GET /api/facts}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FactRow {
    private String eventDate; // YYYY-MM-DD
    private String eventTime; // RFC 3339
    private BigInteger userId;
    private String sessionId;
    private String eventType;
    private String metricName;
    private double metricValue;
}

package com.factql.query;

import lombok.Builder;
import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDate;

/**
 * Normalized raw row fetch. Null fields contribute no filter.
 */
@Data
@Builder
public class RawFactsQuery {
    private LocalDate dateFrom;
    private LocalDate dateTo;
    private String eventType;
    private BigInteger userId;
    private int limit;
    private int offset;
}

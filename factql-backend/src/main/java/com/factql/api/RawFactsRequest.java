package com.factql.api;

import lombok.Builder;
import lombok.Data;

/**
 * Query parameters of {@code GET /api/facts}, kept as the raw strings the client sent.
 */
@Data
@Builder
public class RawFactsRequest {
    private String dateFrom;
    private String dateTo;
    private String eventType;
    private String userId;
    private String limit;
    private String offset;
}

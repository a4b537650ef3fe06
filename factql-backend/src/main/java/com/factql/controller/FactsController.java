package com.factql.controller;

import com.factql.api.ApiResponse;
import com.factql.api.FactRow;
import com.factql.api.QueryRequest;
import com.factql.api.RawFactsRequest;
import com.factql.api.TimeseriesPoint;
import com.factql.api.TimeseriesRequest;
import com.factql.decode.MaterializedRecord;
import com.factql.service.FactQueryService;
import com.factql.store.QueryContext;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/facts")
public class FactsController {
    static final String TIMEOUT_HEADER = "X-Request-Timeout-Ms";

    private final FactQueryService factQueryService;
    private final long defaultTimeoutMs;

    public FactsController(
            FactQueryService factQueryService,
            @Value("${factql.query.timeout-ms:60000}") long defaultTimeoutMs
    ) {
        this.factQueryService = factQueryService;
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    /**
     * Raw fact rows, most recent first.
     *
     * GET /api/facts?date_from&date_to&event_type&user_id&limit&offset
     */
    @GetMapping
    public ResponseEntity<ApiResponse<FactRow>> facts(
            @RequestParam(value = "date_from", required = false) String dateFrom,
            @RequestParam(value = "date_to", required = false) String dateTo,
            @RequestParam(value = "event_type", required = false) String eventType,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "limit", required = false) String limit,
            @RequestParam(value = "offset", required = false) String offset,
            @RequestHeader(value = TIMEOUT_HEADER, required = false) String timeoutMs
    ) {
        RawFactsRequest request = RawFactsRequest.builder()
                .dateFrom(dateFrom)
                .dateTo(dateTo)
                .eventType(eventType)
                .userId(userId)
                .limit(limit)
                .offset(offset)
                .build();
        List<FactRow> rows = factQueryService.fetchFacts(request, newContext(timeoutMs));
        return ResponseEntity.ok(ApiResponse.of(rows));
    }

    /**
     * Grouped aggregation over the fact table.
     *
     * POST /api/facts/aggregate
     */
    @PostMapping("/aggregate")
    public ResponseEntity<ApiResponse<MaterializedRecord>> aggregate(
            @Valid @RequestBody QueryRequest request,
            @RequestHeader(value = TIMEOUT_HEADER, required = false) String timeoutMs
    ) {
        List<MaterializedRecord> records = factQueryService.aggregate(request, newContext(timeoutMs));
        return ResponseEntity.ok(ApiResponse.of(records));
    }

    /**
     * One metric bucketed over time.
     *
     * GET /api/facts/timeseries?date_from&date_to&event_type&metric&granularity
     */
    @GetMapping("/timeseries")
    public ResponseEntity<ApiResponse<TimeseriesPoint>> timeseries(
            @RequestParam(value = "date_from", required = false) String dateFrom,
            @RequestParam(value = "date_to", required = false) String dateTo,
            @RequestParam(value = "event_type", required = false) String eventType,
            @RequestParam(value = "metric", required = false) String metric,
            @RequestParam(value = "granularity", required = false) String granularity,
            @RequestHeader(value = TIMEOUT_HEADER, required = false) String timeoutMs
    ) {
        TimeseriesRequest request = TimeseriesRequest.builder()
                .dateFrom(dateFrom)
                .dateTo(dateTo)
                .eventType(eventType)
                .metric(metric)
                .granularity(granularity)
                .build();
        List<TimeseriesPoint> points = factQueryService.timeseries(request, newContext(timeoutMs));
        return ResponseEntity.ok(ApiResponse.of(points));
    }

    /**
     * The configured deadline, shortened by the caller's timeout header when that is smaller.
     */
    private QueryContext newContext(String timeoutHeader) {
        long timeoutMs = defaultTimeoutMs;
        if (timeoutHeader != null && !timeoutHeader.isBlank()) {
            try {
                long requested = Long.parseLong(timeoutHeader.trim());
                if (requested > 0 && requested < timeoutMs) {
                    timeoutMs = requested;
                }
            } catch (NumberFormatException e) {
                log.debug("Ignoring malformed {} header: {}", TIMEOUT_HEADER, timeoutHeader);
            }
        }
        return QueryContext.withTimeout(Duration.ofMillis(timeoutMs));
    }
}

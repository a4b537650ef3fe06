package com.factql.query;

import com.factql.api.QueryRequest;
import com.factql.api.RawFactsRequest;
import com.factql.api.TimeseriesRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks client requests against the fixed identifier whitelists and normalizes defaults.
 *
 * <p>Tokens are checked in request order and the first offending one is reported, so the same
 * request always yields the same error.
 */
@Slf4j
@Component
public class RequestValidator {

    public static final Set<String> GROUP_BY_COLUMNS = Set.of(
            "event_date", "event_type", "metric_name", "user_id", "session_id");

    public static final List<Metric> DEFAULT_METRICS = List.of(Metric.SUM, Metric.COUNT);

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 10_000;

    private static final BigInteger MAX_UINT64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    /**
     * Validates an aggregate request.
     *
     * @param request parsed request body
     * @return validated request with defaults applied
     * @throws ValidationException on the first invalid group-by column, metric, user id or date
     */
    public ValidatedRequest validate(QueryRequest request) {
        List<String> groupBy = nullToEmpty(request.getGroupBy());
        for (String column : groupBy) {
            if (column == null || !GROUP_BY_COLUMNS.contains(column)) {
                throw reject(ValidationError.Kind.INVALID_GROUP_BY, column);
            }
        }

        List<Metric> metrics = new ArrayList<>();
        for (String name : nullToEmpty(request.getMetrics())) {
            Metric metric = Metric.fromName(name)
                    .orElseThrow(() -> reject(ValidationError.Kind.INVALID_METRIC, name));
            metrics.add(metric);
        }
        if (metrics.isEmpty()) {
            metrics = DEFAULT_METRICS;
        }

        List<BigInteger> userIds = nullToEmpty(request.getUserIds());
        for (BigInteger userId : userIds) {
            if (userId == null || !isUnsigned64(userId)) {
                throw reject(ValidationError.Kind.INVALID_USER_ID, String.valueOf(userId));
            }
        }

        return ValidatedRequest.builder()
                .dateFrom(parseDate(request.getDateFrom()))
                .dateTo(parseDate(request.getDateTo()))
                .eventTypes(nullToEmpty(request.getEventTypes()))
                .userIds(userIds)
                .groupBy(List.copyOf(groupBy))
                .metrics(List.copyOf(metrics))
                .filters(request.getFilters() != null ? request.getFilters() : Map.of())
                .limit(clampLimit(request.getLimit()))
                .offset(request.getOffset() != null ? Math.max(0, request.getOffset()) : 0)
                .build();
    }

    /**
     * Validates a time-series request. Both dates are required.
     *
     * @param request raw query parameters
     * @return normalized query
     * @throws ValidationException when a date is missing or malformed
     */
    public TimeseriesQuery validateTimeseries(TimeseriesRequest request) {
        if (isBlank(request.getDateFrom())) {
            throw reject(ValidationError.Kind.MISSING_FIELD, "date_from");
        }
        if (isBlank(request.getDateTo())) {
            throw reject(ValidationError.Kind.MISSING_FIELD, "date_to");
        }

        return TimeseriesQuery.builder()
                .dateFrom(parseDate(request.getDateFrom()))
                .dateTo(parseDate(request.getDateTo()))
                .eventType(blankToNull(request.getEventType()))
                .metric(blankToNull(request.getMetric()))
                .granularity(Granularity.fromParam(request.getGranularity()))
                .build();
    }

    /**
     * Normalizes raw row fetch parameters. A user id that is not an unsigned 64-bit integer is
     * dropped rather than rejected; unparsable limit and offset read as zero.
     *
     * @param request raw query parameters
     * @return normalized query
     * @throws ValidationException when a date is malformed
     */
    public RawFactsQuery validateRaw(RawFactsRequest request) {
        return RawFactsQuery.builder()
                .dateFrom(parseDate(request.getDateFrom()))
                .dateTo(parseDate(request.getDateTo()))
                .eventType(blankToNull(request.getEventType()))
                .userId(parseUnsigned64(request.getUserId()))
                .limit(clampLimit(parseIntOrZero(request.getLimit())))
                .offset(Math.max(0, parseIntOrZero(request.getOffset())))
                .build();
    }

    /**
     * Clamps a requested row limit into {@code (0, MAX_LIMIT]}.
     *
     * @param limit requested limit, may be null
     * @return the limit itself when in range, otherwise {@link #DEFAULT_LIMIT}
     */
    public static int clampLimit(Integer limit) {
        if (limit == null || limit <= 0 || limit > MAX_LIMIT) {
            return DEFAULT_LIMIT;
        }
        return limit;
    }

    private static ValidationException reject(ValidationError.Kind kind, String value) {
        log.debug("Request rejected: kind={}, value={}", kind, value);
        return new ValidationException(kind, value);
    }

    private static LocalDate parseDate(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim(), DateTimeFormatter.ISO_LOCAL_DATE);
        } catch (DateTimeParseException e) {
            throw reject(ValidationError.Kind.INVALID_DATE, value);
        }
    }

    private static BigInteger parseUnsigned64(String value) {
        if (isBlank(value)) {
            return null;
        }
        try {
            BigInteger parsed = new BigInteger(value.trim());
            return isUnsigned64(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int parseIntOrZero(String value) {
        if (isBlank(value)) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static boolean isUnsigned64(BigInteger value) {
        return value.signum() >= 0 && value.compareTo(MAX_UINT64) <= 0;
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package com.factql.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Builds parameterized queries against the {@code facts} table.
 *
 * <p>Client-supplied values only ever travel as bound arguments. The identifiers spliced into
 * the text come from {@link RequestValidator#GROUP_BY_COLUMNS}, {@link Metric} and
 * {@link Granularity}; limit and offset are server-clamped integers.
 *
 * <p>Inputs are expected to have passed {@link RequestValidator}; this class does not report
 * client errors.
 */
@Slf4j
@Component
public class QueryBuilder {

    public static final String TABLE = "facts";

    static final String RAW_PROJECTION =
            "event_date, event_time, user_id, session_id, event_type, metric_name, metric_value";

    private static final Map<String, String> TIMESERIES_METRICS = Map.of(
            "avg", "avg(metric_value)",
            "count", "count()",
            "uniq", "uniq(user_id)");

    private static final String DEFAULT_TIMESERIES_METRIC = "sum(metric_value)";

    /**
     * Raw row fetch, most recent event first.
     *
     * @param query normalized request
     * @return built query
     */
    public BuiltQuery buildRawQuery(RawFactsQuery query) {
        Conditions where = new Conditions();
        if (query.getDateFrom() != null) {
            where.add("event_date >= ?", query.getDateFrom());
        }
        if (query.getDateTo() != null) {
            where.add("event_date <= ?", query.getDateTo());
        }
        if (query.getEventType() != null) {
            where.add("event_type = ?", query.getEventType());
        }
        if (query.getUserId() != null) {
            where.add("user_id = ?", query.getUserId());
        }

        StringBuilder sql = new StringBuilder("SELECT ")
                .append(RAW_PROJECTION)
                .append(" FROM ").append(TABLE);
        where.appendTo(sql);
        sql.append(" ORDER BY event_time DESC")
                .append(" LIMIT ").append(query.getLimit())
                .append(" OFFSET ").append(query.getOffset());
        return new BuiltQuery(BuiltQuery.Shape.RAW, sql.toString(), where.args);
    }

    /**
     * Grouped aggregation: group-by columns followed by one aliased expression per metric,
     * ordered by the first metric, largest first.
     *
     * @param request validated request with at least one metric
     * @return built query
     */
    public BuiltQuery buildAggregateQuery(ValidatedRequest request) {
        List<Metric> metrics = request.getMetrics();
        if (metrics == null || metrics.isEmpty()) {
            throw new IllegalStateException("aggregate query requires at least one metric");
        }
        List<String> groupBy = request.getGroupBy() != null ? request.getGroupBy() : List.of();

        List<String> select = new ArrayList<>(groupBy);
        for (Metric metric : metrics) {
            select.add(metric.getExpression() + " AS " + metric.getAlias());
        }

        Conditions where = new Conditions();
        if (request.getDateFrom() != null) {
            where.add("event_date >= ?", request.getDateFrom());
        }
        if (request.getDateTo() != null) {
            where.add("event_date <= ?", request.getDateTo());
        }
        where.addIn("event_type", request.getEventTypes());
        where.addIn("user_id", request.getUserIds());

        if (request.getFilters() != null && !request.getFilters().isEmpty()) {
            log.debug("Dimension filters are not applied to aggregate queries: {}", request.getFilters().keySet());
        }

        StringBuilder sql = new StringBuilder("SELECT ")
                .append(String.join(", ", select))
                .append(" FROM ").append(TABLE);
        where.appendTo(sql);
        if (!groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupBy));
        }
        sql.append(" ORDER BY ").append(metrics.get(0).getAlias()).append(" DESC");
        sql.append(" LIMIT ").append(request.getLimit());
        if (request.getOffset() > 0) {
            sql.append(" OFFSET ").append(request.getOffset());
        }
        return new BuiltQuery(BuiltQuery.Shape.AGGREGATE, sql.toString(), where.args);
    }

    /**
     * Time series of one metric bucketed by the requested granularity. An unrecognized metric
     * name silently becomes {@code sum(metric_value)}.
     *
     * @param query normalized request with both dates set
     * @return built query selecting {@code period} and {@code value}
     */
    public BuiltQuery buildTimeseriesQuery(TimeseriesQuery query) {
        String metricExpr = timeseriesMetricExpression(query.getMetric());
        Granularity granularity = query.getGranularity() != null ? query.getGranularity() : Granularity.DAY;

        Conditions where = new Conditions();
        where.add("event_date >= ?", query.getDateFrom());
        where.add("event_date <= ?", query.getDateTo());
        if (query.getEventType() != null) {
            where.add("event_type = ?", query.getEventType());
        }

        StringBuilder sql = new StringBuilder("SELECT ")
                .append(granularity.getBucketExpression()).append(" AS period, ")
                .append(metricExpr).append(" AS value")
                .append(" FROM ").append(TABLE);
        where.appendTo(sql);
        sql.append(" GROUP BY period ORDER BY period");
        return new BuiltQuery(BuiltQuery.Shape.TIMESERIES, sql.toString(), where.args);
    }

    static String timeseriesMetricExpression(String metric) {
        if (metric == null) {
            return DEFAULT_TIMESERIES_METRIC;
        }
        return TIMESERIES_METRICS.getOrDefault(metric, DEFAULT_TIMESERIES_METRIC);
    }

    private static final class Conditions {
        private final List<String> clauses = new ArrayList<>();
        private final List<Object> args = new ArrayList<>();

        private void add(String clause, Object arg) {
            clauses.add(clause);
            args.add(arg);
        }

        private void addIn(String column, List<?> values) {
            if (values == null || values.isEmpty()) {
                return;
            }
            clauses.add(column + " IN (" + String.join(",", Collections.nCopies(values.size(), "?")) + ")");
            args.addAll(values);
        }

        private void appendTo(StringBuilder sql) {
            if (!clauses.isEmpty()) {
                sql.append(" WHERE ").append(String.join(" AND ", clauses));
            }
        }
    }
}

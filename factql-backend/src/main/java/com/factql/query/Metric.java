package com.factql.query;

import java.util.Arrays;
import java.util.Optional;

/**
 * Aggregate metrics a client may request on the aggregate endpoint.
 *
 * <p>The metric name doubles as the SQL alias of its expression, so only names from this
 * enum ever reach query text.
 */
public enum Metric {
    SUM("sum", "sum(metric_value)"),
    AVG("avg", "avg(metric_value)"),
    COUNT("count", "count()"),
    MIN("min", "min(metric_value)"),
    MAX("max", "max(metric_value)"),
    UNIQ("uniq", "uniq(user_id)");

    private final String alias;
    private final String expression;

    Metric(String alias, String expression) {
        this.alias = alias;
        this.expression = expression;
    }

    public String getAlias() {
        return alias;
    }

    public String getExpression() {
        return expression;
    }

    /**
     * Looks up a metric by its client-facing name (case-sensitive).
     *
     * @param name requested metric name
     * @return matching metric, or empty when the name is not whitelisted
     */
    public static Optional<Metric> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(m -> m.alias.equals(name))
                .findFirst();
    }
}

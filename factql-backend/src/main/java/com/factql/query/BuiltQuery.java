package com.factql.query;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Query text with positional {@code ?} placeholders and the arguments bound to them, in order.
 */
public final class BuiltQuery {

    /**
     * Which request shape produced the query. Used for logging.
     */
    public enum Shape {
        RAW,
        AGGREGATE,
        TIMESERIES
    }

    private final Shape shape;
    private final String sql;
    private final List<Object> args;

    public BuiltQuery(Shape shape, String sql, List<Object> args) {
        this.shape = Objects.requireNonNull(shape, "shape");
        this.sql = Objects.requireNonNull(sql, "sql");
        this.args = Collections.unmodifiableList(args);
    }

    public Shape getShape() {
        return shape;
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getArgs() {
        return args;
    }

    @Override
    public String toString() {
        return "BuiltQuery{shape=" + shape + ", sql='" + sql + "', args=" + args.size() + "}";
    }
}

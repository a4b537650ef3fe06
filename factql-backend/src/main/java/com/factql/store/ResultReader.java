package com.factql.store;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Consumes a whole result set into a value.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ResultReader<T> {
    T read(ResultSet rs, QueryContext context) throws SQLException;
}

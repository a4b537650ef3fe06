package com.factql.store;

/**
 * Thrown when a {@link QueryContext} is cancelled or passes its deadline while a query runs.
 * Rows decoded before the cancellation are discarded.
 */
public class QueryCancelledException extends StorageException {

    public QueryCancelledException(String reason) {
        super("query cancelled: " + reason);
    }

    public QueryCancelledException(String reason, Throwable cause) {
        super("query cancelled: " + reason, cause);
    }
}

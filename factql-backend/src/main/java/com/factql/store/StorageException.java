package com.factql.store;

/**
 * Any failure reported by the analytical store, including an unreachable server.
 * The store's own message is kept as this exception's message.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

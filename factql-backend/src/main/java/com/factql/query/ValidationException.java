package com.factql.query;

/**
 * Thrown when a request is rejected before any query is built.
 */
public class ValidationException extends RuntimeException {
    private final ValidationError error;

    /**
     * Create a new exception.
     *
     * @param kind what was wrong
     * @param value the offending value, or the missing field name
     */
    public ValidationException(ValidationError.Kind kind, String value) {
        this(new ValidationError(kind, value));
    }

    public ValidationException(ValidationError error) {
        super(error.getMessage());
        this.error = error;
    }

    public ValidationError getError() {
        return error;
    }
}

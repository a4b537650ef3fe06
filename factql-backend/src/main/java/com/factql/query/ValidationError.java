package com.factql.query;

import lombok.Data;

/**
 * The first offending token of a rejected request.
 */
@Data
public class ValidationError {

    public enum Kind {
        INVALID_GROUP_BY("invalid group_by column: %s"),
        INVALID_METRIC("invalid metric: %s"),
        INVALID_USER_ID("invalid user_id: %s"),
        INVALID_DATE("invalid date: %s"),
        MISSING_FIELD("%s required");

        private final String messageFormat;

        Kind(String messageFormat) {
            this.messageFormat = messageFormat;
        }
    }

    private final Kind kind;
    private final String value;

    public String getMessage() {
        return String.format(kind.messageFormat, value);
    }
}

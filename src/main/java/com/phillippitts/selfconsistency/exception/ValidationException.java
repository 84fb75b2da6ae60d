package com.phillippitts.selfconsistency.exception;

/**
 * Thrown when request parameters are missing or out of bounds.
 * Raised before any model call is issued and never retried.
 */
public class ValidationException extends ReasoningEngineException {

    private final String field;
    private final String reason;

    public ValidationException(String field, String reason) {
        super("Invalid request field '" + field + "': " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}

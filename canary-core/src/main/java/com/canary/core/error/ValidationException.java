package com.canary.core.error;

/**
 * Malformed input: rating out of range, missing field, unknown source.
 * Rejected before anything is written.
 */
public class ValidationException extends IntelException {

    private final String field;

    public ValidationException(String message) {
        this(null, message);
    }

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Name of the offending field, or null when the problem is not tied to one field.
     */
    public String getField() {
        return field;
    }

    @Override
    protected String defaultErrorCode() {
        return "ERR-VAL";
    }
}

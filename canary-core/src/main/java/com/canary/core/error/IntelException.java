package com.canary.core.error;

/**
 * Base class for errors raised by the intelligence engine.
 * Each subclass carries a stable error code so callers and logs can tell them apart.
 */
public abstract class IntelException extends RuntimeException {

    private final String errorCode;

    protected IntelException(String message) {
        super(message);
        this.errorCode = defaultErrorCode();
    }

    protected IntelException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = defaultErrorCode();
    }

    protected IntelException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    protected abstract String defaultErrorCode();
}

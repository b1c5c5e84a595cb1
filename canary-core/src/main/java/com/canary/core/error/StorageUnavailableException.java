package com.canary.core.error;

/**
 * The backing store could not be read or written.
 * Fatal for the current operation: nothing may be assumed to have been learned.
 */
public class StorageUnavailableException extends IntelException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String defaultErrorCode() {
        return "ERR-STORE";
    }
}

package com.canary.core.error;

/**
 * A stored record violates its own invariants, e.g. a pattern with
 * {@code sample_count = 0} but a non-zero urgency sum.
 */
public class CorruptRecordException extends IntelException {

    private final String table;
    private final String recordKey;
    private final String reason;

    public CorruptRecordException(String table, String recordKey, String reason) {
        super(table + "[" + recordKey + "]: " + reason);
        this.table = table;
        this.recordKey = recordKey;
        this.reason = reason;
    }

    public String getTable() {
        return table;
    }

    public String getRecordKey() {
        return recordKey;
    }

    public String getReason() {
        return reason;
    }

    @Override
    protected String defaultErrorCode() {
        return "ERR-CORRUPT";
    }
}

package com.canary.intel.store;

import com.canary.core.error.CorruptRecordException;
import com.canary.intel.model.QuarantinedRecord;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * Moves corrupt rows out of their table into quarantined_records.
 * Call inside a write transaction so the copy and the delete land together.
 */
public interface QuarantineRepo {

    /**
     * Copy the row named by the exception into quarantine and delete it.
     * Returns false if the row no longer exists.
     */
    boolean quarantine(CorruptRecordException corrupt, Instant detectedAt) throws SQLException;

    List<QuarantinedRecord> findAll() throws SQLException;

    int count() throws SQLException;
}

package com.canary.intel.store;

import com.canary.core.error.CorruptRecordException;

import java.sql.SQLException;
import java.util.List;

/**
 * A table whose rows carry invariants that can be checked on load.
 * Corrupt rows are skipped by reads and listed here for the quarantine sweep.
 */
public interface RecordTable {

    String tableName();

    List<CorruptRecordException> scanCorrupt() throws SQLException;
}

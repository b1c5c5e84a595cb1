package com.canary.intel.store;

import com.canary.intel.model.Pattern;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for learned patterns.
 * {@link #find} throws CorruptRecordException for a row that fails its invariants;
 * list reads skip such rows.
 */
public interface PatternRepo extends RecordTable {

    Optional<Pattern> find(String signature) throws SQLException;

    List<Pattern> findByCoarseKey(String coarseKey) throws SQLException;

    List<Pattern> findAll() throws SQLException;

    /**
     * Patterns not updated since the cutoff.
     */
    List<Pattern> findStale(Instant cutoff) throws SQLException;

    void save(Pattern pattern) throws SQLException;

    void updateConfidence(String signature, double confidence) throws SQLException;

    int count() throws SQLException;
}

package com.canary.intel.store;

import com.canary.intel.model.PredictionRecord;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PredictionRepo extends RecordTable {

    void save(PredictionRecord record) throws SQLException;

    Optional<PredictionRecord> find(String predictionId) throws SQLException;

    /**
     * Most recent unrealized prediction for the headline and source made within [from, to].
     */
    Optional<PredictionRecord> findLatestUnrealized(String headline, String source, Instant from, Instant to)
        throws SQLException;

    void attachOutcome(String predictionId, double realizedScore, double error, Instant realizedAt)
        throws SQLException;

    /**
     * Realized predictions made at or after {@code since}; all of them when since is null.
     */
    List<PredictionRecord> findRealized(Instant since) throws SQLException;

    int count() throws SQLException;
}

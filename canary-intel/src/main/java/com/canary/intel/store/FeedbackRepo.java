package com.canary.intel.store;

import com.canary.intel.model.FeedbackRecord;
import com.canary.intel.model.FeedbackType;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Map;

/**
 * Ingested feedback. (kind, feedback key) is unique: a second insert fails
 * with a constraint violation.
 */
public interface FeedbackRepo {

    boolean exists(FeedbackRecord.FeedbackKind kind, String feedbackKey) throws SQLException;

    void insert(FeedbackRecord record, FeedbackType type) throws SQLException;

    int count() throws SQLException;

    Map<FeedbackType, Integer> countByTypeSince(Instant since) throws SQLException;
}

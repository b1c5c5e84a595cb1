package com.canary.intel.store.dao;

import com.canary.intel.model.ArticleFeedback;
import com.canary.intel.model.DigestFeedback;
import com.canary.intel.model.FeedbackRecord;
import com.canary.intel.model.FeedbackType;
import com.canary.intel.store.FeedbackRepo;
import com.canary.intel.store.IntelDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * DAO for ingested feedback records.
 */
public class SqliteFeedbackRepo implements FeedbackRepo {

    private static final Logger log = LoggerFactory.getLogger(SqliteFeedbackRepo.class);

    private final IntelDatabase db;

    public SqliteFeedbackRepo(IntelDatabase db) {
        this.db = db;
    }

    @Override
    public boolean exists(FeedbackRecord.FeedbackKind kind, String feedbackKey) throws SQLException {
        Connection c = db.getConnection();

        try (PreparedStatement stmt = c.prepareStatement(
                "SELECT 1 FROM feedback_records WHERE kind = ? AND feedback_key = ?")) {
            stmt.setString(1, kind.name());
            stmt.setString(2, feedbackKey);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public void insert(FeedbackRecord record, FeedbackType type) throws SQLException {
        Connection c = db.getConnection();

        String sql = """
            INSERT INTO feedback_records
            (kind, feedback_key, rating, irrelevant, headline, source, content_type,
             comment, ai_score, prediction_id, feedback_type, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, record.kind().name());
            stmt.setString(2, record.feedbackKey());
            if (record instanceof ArticleFeedback article) {
                Rows.setNullableDouble(stmt, 3, article.rating());
                stmt.setInt(4, article.irrelevant() ? 1 : 0);
                stmt.setString(5, article.headline());
                stmt.setString(6, article.source());
                stmt.setString(7, article.contentType());
                Rows.setNullableDouble(stmt, 9, article.aiScore());
                stmt.setString(10, article.predictionId());
            } else if (record instanceof DigestFeedback digest) {
                stmt.setDouble(3, digest.rating());
                stmt.setInt(4, 0);
                stmt.setString(5, null);
                stmt.setString(6, null);
                stmt.setString(7, null);
                Rows.setNullableDouble(stmt, 9, null);
                stmt.setString(10, null);
            }
            stmt.setString(8, record.comment());
            stmt.setString(11, type.name());
            Rows.setInstant(stmt, 12, record.createdAt());
            stmt.executeUpdate();
        }

        log.debug("Stored {} feedback {} as {}", record.kind(), record.feedbackKey(), type);
    }

    @Override
    public int count() throws SQLException {
        Connection c = db.getConnection();

        try (PreparedStatement stmt = c.prepareStatement("SELECT COUNT(*) FROM feedback_records");
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return rs.getInt(1);
            }
        }
        return 0;
    }

    @Override
    public Map<FeedbackType, Integer> countByTypeSince(Instant since) throws SQLException {
        Connection c = db.getConnection();
        Map<FeedbackType, Integer> counts = new EnumMap<>(FeedbackType.class);

        String sql = """
            SELECT feedback_type, COUNT(*) AS n
            FROM feedback_records
            WHERE created_at >= ?
            GROUP BY feedback_type
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setLong(1, since.toEpochMilli());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String name = rs.getString("feedback_type");
                    try {
                        counts.put(FeedbackType.valueOf(name), rs.getInt("n"));
                    } catch (IllegalArgumentException e) {
                        log.warn("Ignoring unknown feedback type '{}'", name);
                    }
                }
            }
        }
        return counts;
    }
}

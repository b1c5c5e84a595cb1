package com.canary.intel.store.dao;

import com.canary.core.error.CorruptRecordException;
import com.canary.core.model.Scores;
import com.canary.intel.model.PredictionRecord;
import com.canary.intel.store.IntelDatabase;
import com.canary.intel.store.PredictionRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DAO for prediction tracking.
 */
public class SqlitePredictionRepo implements PredictionRepo {

    private static final Logger log = LoggerFactory.getLogger(SqlitePredictionRepo.class);

    static final String TABLE = "prediction_tracking";

    private static final String COLUMNS = """
        rowid AS row_id, prediction_id, headline, source, content_type, inputs_snapshot,
        predicted_score, fallback_used, predicted_at, realized_score, error, realized_at
        """;

    private final IntelDatabase db;

    public SqlitePredictionRepo(IntelDatabase db) {
        this.db = db;
    }

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public void save(PredictionRecord record) throws SQLException {
        Connection c = db.getConnection();

        String sql = """
            INSERT INTO prediction_tracking
            (prediction_id, headline, source, content_type, inputs_snapshot,
             predicted_score, fallback_used, predicted_at, realized_score, error, realized_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, record.predictionId());
            stmt.setString(2, record.headline());
            stmt.setString(3, record.source());
            stmt.setString(4, record.contentType());
            stmt.setString(5, record.inputsSnapshot());
            stmt.setDouble(6, record.predictedScore());
            stmt.setInt(7, record.fallbackUsed() ? 1 : 0);
            Rows.setInstant(stmt, 8, record.predictedAt());
            Rows.setNullableDouble(stmt, 9, record.realizedScore());
            Rows.setNullableDouble(stmt, 10, record.error());
            Rows.setInstant(stmt, 11, record.realizedAt());
            stmt.executeUpdate();
        }
    }

    @Override
    public Optional<PredictionRecord> find(String predictionId) throws SQLException {
        Connection c = db.getConnection();

        try (PreparedStatement stmt = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM prediction_tracking WHERE prediction_id = ?")) {
            stmt.setString(1, predictionId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(map(rs));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<PredictionRecord> findLatestUnrealized(String headline, String source, Instant from, Instant to)
            throws SQLException {
        String sql = "SELECT " + COLUMNS + """
             FROM prediction_tracking
            WHERE headline = ? AND source = ? AND realized_score IS NULL
              AND predicted_at >= ? AND predicted_at <= ?
            ORDER BY predicted_at DESC
            """;
        List<PredictionRecord> found = query(sql, headline, source, from.toEpochMilli(), to.toEpochMilli());
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public void attachOutcome(String predictionId, double realizedScore, double error, Instant realizedAt)
            throws SQLException {
        Connection c = db.getConnection();

        String sql = """
            UPDATE prediction_tracking
            SET realized_score = ?, error = ?, realized_at = ?
            WHERE prediction_id = ?
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setDouble(1, realizedScore);
            stmt.setDouble(2, error);
            Rows.setInstant(stmt, 3, realizedAt);
            stmt.setString(4, predictionId);
            stmt.executeUpdate();
        }
    }

    @Override
    public List<PredictionRecord> findRealized(Instant since) throws SQLException {
        if (since == null) {
            return query("SELECT " + COLUMNS + """
                 FROM prediction_tracking
                WHERE realized_score IS NOT NULL
                ORDER BY predicted_at, prediction_id
                """);
        }
        return query("SELECT " + COLUMNS + """
             FROM prediction_tracking
            WHERE realized_score IS NOT NULL AND predicted_at >= ?
            ORDER BY predicted_at, prediction_id
            """, since.toEpochMilli());
    }

    @Override
    public int count() throws SQLException {
        Connection c = db.getConnection();

        try (PreparedStatement stmt = c.prepareStatement("SELECT COUNT(*) FROM prediction_tracking");
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return rs.getInt(1);
            }
        }
        return 0;
    }

    @Override
    public List<CorruptRecordException> scanCorrupt() throws SQLException {
        Connection c = db.getConnection();
        List<CorruptRecordException> corrupt = new ArrayList<>();

        try (PreparedStatement stmt = c.prepareStatement("SELECT " + COLUMNS + " FROM prediction_tracking");
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                try {
                    map(rs);
                } catch (CorruptRecordException e) {
                    corrupt.add(e);
                }
            }
        }
        return corrupt;
    }

    private List<PredictionRecord> query(String sql, Object... params) throws SQLException {
        Connection c = db.getConnection();
        List<PredictionRecord> records = new ArrayList<>();

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    try {
                        records.add(map(rs));
                    } catch (CorruptRecordException e) {
                        log.warn("Skipping corrupt prediction: {}", e.getMessage());
                    }
                }
            }
        }
        return records;
    }

    private PredictionRecord map(ResultSet rs) throws SQLException {
        String id = Rows.requireText(rs, TABLE, "prediction_id");
        double predicted = Rows.requireDouble(rs, TABLE, "predicted_score", Scores.MIN_URGENCY, Scores.MAX_URGENCY);
        Double realized = Rows.nullableDouble(rs, "realized_score");
        if (realized != null && !Scores.isUrgency(realized)) {
            throw Rows.corrupt(rs, TABLE, "realized_score out of range: " + realized);
        }
        return new PredictionRecord(
            id,
            rs.getString("headline"),
            rs.getString("source"),
            rs.getString("content_type"),
            rs.getString("inputs_snapshot"),
            predicted,
            rs.getInt("fallback_used") != 0,
            Rows.requireInstant(rs, TABLE, "predicted_at"),
            realized,
            Rows.nullableDouble(rs, "error"),
            Rows.instant(rs, "realized_at")
        );
    }
}

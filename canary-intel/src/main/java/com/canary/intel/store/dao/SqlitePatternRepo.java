package com.canary.intel.store.dao;

import com.canary.core.error.CorruptRecordException;
import com.canary.core.model.Scores;
import com.canary.intel.model.Pattern;
import com.canary.intel.store.IntelDatabase;
import com.canary.intel.store.PatternRepo;
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
 * DAO for learned patterns.
 */
public class SqlitePatternRepo implements PatternRepo {

    private static final Logger log = LoggerFactory.getLogger(SqlitePatternRepo.class);

    static final String TABLE = "patterns";

    private static final String COLUMNS = """
        rowid AS row_id, signature, coarse_key, sample_urgency_sum, sample_count, confidence, last_updated
        """;

    private final IntelDatabase db;

    public SqlitePatternRepo(IntelDatabase db) {
        this.db = db;
    }

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public Optional<Pattern> find(String signature) throws SQLException {
        Connection c = db.getConnection();

        String sql = "SELECT " + COLUMNS + " FROM patterns WHERE signature = ?";

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, signature);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(map(rs));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Pattern> findByCoarseKey(String coarseKey) throws SQLException {
        return query("SELECT " + COLUMNS + " FROM patterns WHERE coarse_key = ? ORDER BY signature", coarseKey);
    }

    @Override
    public List<Pattern> findAll() throws SQLException {
        return query("SELECT " + COLUMNS + " FROM patterns ORDER BY signature");
    }

    @Override
    public List<Pattern> findStale(Instant cutoff) throws SQLException {
        return query("SELECT " + COLUMNS + " FROM patterns WHERE last_updated < ? ORDER BY signature",
            cutoff.toEpochMilli());
    }

    /**
     * Insert or update. Only the named columns are touched, so columns added by a
     * newer schema keep their values.
     */
    @Override
    public void save(Pattern pattern) throws SQLException {
        Connection c = db.getConnection();

        String sql = """
            INSERT INTO patterns (signature, coarse_key, sample_urgency_sum, sample_count, confidence, last_updated)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT(signature) DO UPDATE SET
                coarse_key = excluded.coarse_key,
                sample_urgency_sum = excluded.sample_urgency_sum,
                sample_count = excluded.sample_count,
                confidence = excluded.confidence,
                last_updated = excluded.last_updated
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, pattern.signature());
            stmt.setString(2, pattern.coarseKey());
            stmt.setDouble(3, pattern.sampleUrgencySum());
            stmt.setDouble(4, pattern.sampleCount());
            stmt.setDouble(5, pattern.confidence());
            Rows.setInstant(stmt, 6, pattern.lastUpdated());
            stmt.executeUpdate();
        }
    }

    @Override
    public void updateConfidence(String signature, double confidence) throws SQLException {
        Connection c = db.getConnection();

        try (PreparedStatement stmt = c.prepareStatement("UPDATE patterns SET confidence = ? WHERE signature = ?")) {
            stmt.setDouble(1, confidence);
            stmt.setString(2, signature);
            stmt.executeUpdate();
        }
    }

    @Override
    public int count() throws SQLException {
        Connection c = db.getConnection();

        try (PreparedStatement stmt = c.prepareStatement("SELECT COUNT(*) FROM patterns");
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

        try (PreparedStatement stmt = c.prepareStatement("SELECT " + COLUMNS + " FROM patterns");
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

    private List<Pattern> query(String sql, Object... params) throws SQLException {
        Connection c = db.getConnection();
        List<Pattern> patterns = new ArrayList<>();

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    try {
                        patterns.add(map(rs));
                    } catch (CorruptRecordException e) {
                        log.warn("Skipping corrupt pattern: {}", e.getMessage());
                    }
                }
            }
        }
        return patterns;
    }

    private Pattern map(ResultSet rs) throws SQLException {
        String signature = Rows.requireText(rs, TABLE, "signature");
        String coarseKey = rs.getString("coarse_key");
        double count = Rows.requireDouble(rs, TABLE, "sample_count", Double.MIN_VALUE, Double.MAX_VALUE);
        double sum = Rows.requireDouble(rs, TABLE, "sample_urgency_sum", 0.0, Double.MAX_VALUE);
        if (sum / count > Scores.MAX_URGENCY + 1e-9) {
            throw Rows.corrupt(rs, TABLE, "derived urgency above " + Scores.MAX_URGENCY);
        }
        double confidence = Rows.requireDouble(rs, TABLE, "confidence", 0.0, 1.0);
        Instant lastUpdated = Rows.requireInstant(rs, TABLE, "last_updated");

        return new Pattern(signature, coarseKey == null ? "" : coarseKey, sum, count, confidence, lastUpdated);
    }
}

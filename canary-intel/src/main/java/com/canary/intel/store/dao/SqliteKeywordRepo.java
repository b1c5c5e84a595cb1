package com.canary.intel.store.dao;

import com.canary.core.error.CorruptRecordException;
import com.canary.core.model.Scores;
import com.canary.intel.model.KeywordWeight;
import com.canary.intel.store.IntelDatabase;
import com.canary.intel.store.KeywordRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DAO for keyword weights.
 */
public class SqliteKeywordRepo implements KeywordRepo {

    private static final Logger log = LoggerFactory.getLogger(SqliteKeywordRepo.class);

    static final String TABLE = "keyword_weights";

    private static final String COLUMNS = "rowid AS row_id, term, weight, sample_count, last_updated";

    private final IntelDatabase db;

    public SqliteKeywordRepo(IntelDatabase db) {
        this.db = db;
    }

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public Optional<KeywordWeight> find(String term) throws SQLException {
        Connection c = db.getConnection();

        try (PreparedStatement stmt = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM keyword_weights WHERE term = ?")) {
            stmt.setString(1, term);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(map(rs));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public Map<String, KeywordWeight> findAll(Collection<String> terms) throws SQLException {
        Map<String, KeywordWeight> found = new LinkedHashMap<>();
        if (terms.isEmpty()) {
            return found;
        }

        Connection c = db.getConnection();
        try (PreparedStatement stmt = c.prepareStatement(
                "SELECT " + COLUMNS + " FROM keyword_weights WHERE term = ?")) {
            for (String term : terms) {
                stmt.setString(1, term);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (rs.next()) {
                        try {
                            found.put(term, map(rs));
                        } catch (CorruptRecordException e) {
                            log.warn("Skipping corrupt keyword weight: {}", e.getMessage());
                        }
                    }
                }
            }
        }
        return found;
    }

    @Override
    public List<KeywordWeight> findTop(int limit) throws SQLException {
        Connection c = db.getConnection();
        List<KeywordWeight> weights = new ArrayList<>();

        String sql = """
            SELECT rowid AS row_id, term, weight, sample_count, last_updated
            FROM keyword_weights
            ORDER BY weight DESC, term ASC
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next() && weights.size() < limit) {
                try {
                    weights.add(map(rs));
                } catch (CorruptRecordException e) {
                    log.warn("Skipping corrupt keyword weight: {}", e.getMessage());
                }
            }
        }
        return weights;
    }

    @Override
    public void save(KeywordWeight weight) throws SQLException {
        Connection c = db.getConnection();

        String sql = """
            INSERT INTO keyword_weights (term, weight, sample_count, last_updated)
            VALUES (?, ?, ?, ?)
            ON CONFLICT(term) DO UPDATE SET
                weight = excluded.weight,
                sample_count = excluded.sample_count,
                last_updated = excluded.last_updated
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, weight.term());
            stmt.setDouble(2, weight.weight());
            stmt.setDouble(3, weight.sampleCount());
            Rows.setInstant(stmt, 4, weight.lastUpdated());
            stmt.executeUpdate();
        }
    }

    @Override
    public int count() throws SQLException {
        Connection c = db.getConnection();

        try (PreparedStatement stmt = c.prepareStatement("SELECT COUNT(*) FROM keyword_weights");
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

        try (PreparedStatement stmt = c.prepareStatement("SELECT " + COLUMNS + " FROM keyword_weights");
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

    private KeywordWeight map(ResultSet rs) throws SQLException {
        return new KeywordWeight(
            Rows.requireText(rs, TABLE, "term"),
            Rows.requireDouble(rs, TABLE, "weight", Scores.MIN_URGENCY, Scores.MAX_URGENCY),
            Rows.requireDouble(rs, TABLE, "sample_count", 0.0, Double.MAX_VALUE),
            Rows.requireInstant(rs, TABLE, "last_updated")
        );
    }
}

package com.canary.intel.store.dao;

import com.canary.core.error.CorruptRecordException;
import com.canary.intel.model.SourceReliability;
import com.canary.intel.store.IntelDatabase;
import com.canary.intel.store.SourceRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DAO for per-source reliability.
 */
public class SqliteSourceRepo implements SourceRepo {

    private static final Logger log = LoggerFactory.getLogger(SqliteSourceRepo.class);

    static final String TABLE = "source_reliability";

    private static final String COLUMNS = """
        rowid AS row_id, source, content_type, reliability, sample_count, last_updated, decayed_at
        """;

    private final IntelDatabase db;

    public SqliteSourceRepo(IntelDatabase db) {
        this.db = db;
    }

    @Override
    public String tableName() {
        return TABLE;
    }

    @Override
    public Optional<SourceReliability> find(String source, String contentType) throws SQLException {
        Connection c = db.getConnection();

        String sql = "SELECT " + COLUMNS + " FROM source_reliability WHERE source = ? AND content_type = ?";

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, source);
            stmt.setString(2, contentType);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(map(rs));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public List<SourceReliability> findAll() throws SQLException {
        Connection c = db.getConnection();
        List<SourceReliability> sources = new ArrayList<>();

        String sql = "SELECT " + COLUMNS + " FROM source_reliability ORDER BY source, content_type";

        try (PreparedStatement stmt = c.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                try {
                    sources.add(map(rs));
                } catch (CorruptRecordException e) {
                    log.warn("Skipping corrupt source reliability: {}", e.getMessage());
                }
            }
        }
        return sources;
    }

    @Override
    public void save(SourceReliability reliability) throws SQLException {
        Connection c = db.getConnection();

        String sql = """
            INSERT INTO source_reliability (source, content_type, reliability, sample_count, last_updated, decayed_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT(source, content_type) DO UPDATE SET
                reliability = excluded.reliability,
                sample_count = excluded.sample_count,
                last_updated = excluded.last_updated,
                decayed_at = excluded.decayed_at
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, reliability.source());
            stmt.setString(2, reliability.contentType());
            stmt.setDouble(3, reliability.reliability());
            stmt.setDouble(4, reliability.sampleCount());
            Rows.setInstant(stmt, 5, reliability.lastUpdated());
            Rows.setInstant(stmt, 6, reliability.decayedAt());
            stmt.executeUpdate();
        }
    }

    @Override
    public List<CorruptRecordException> scanCorrupt() throws SQLException {
        Connection c = db.getConnection();
        List<CorruptRecordException> corrupt = new ArrayList<>();

        try (PreparedStatement stmt = c.prepareStatement("SELECT " + COLUMNS + " FROM source_reliability");
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

    private SourceReliability map(ResultSet rs) throws SQLException {
        return new SourceReliability(
            Rows.requireText(rs, TABLE, "source"),
            Rows.requireText(rs, TABLE, "content_type"),
            Rows.requireDouble(rs, TABLE, "reliability", 0.0, 1.0),
            Rows.requireDouble(rs, TABLE, "sample_count", 0.0, Double.MAX_VALUE),
            Rows.requireInstant(rs, TABLE, "last_updated"),
            Rows.instant(rs, "decayed_at")
        );
    }
}

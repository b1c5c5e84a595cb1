package com.canary.intel.store.dao;

import com.canary.intel.model.Digest;
import com.canary.intel.model.DigestHeadline;
import com.canary.intel.store.DigestRepo;
import com.canary.intel.store.IntelDatabase;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DAO for registered digests and their ordered headlines.
 */
public class SqliteDigestRepo implements DigestRepo {

    private final IntelDatabase db;

    public SqliteDigestRepo(IntelDatabase db) {
        this.db = db;
    }

    @Override
    public void save(Digest digest) throws SQLException {
        db.executeInTransaction(c -> {
            try (PreparedStatement stmt = c.prepareStatement("""
                    INSERT INTO digests (digest_id, predicted_score, created_at)
                    VALUES (?, ?, ?)
                    ON CONFLICT(digest_id) DO UPDATE SET
                        predicted_score = excluded.predicted_score,
                        created_at = excluded.created_at
                    """)) {
                stmt.setString(1, digest.digestId());
                stmt.setDouble(2, digest.predictedScore());
                Rows.setInstant(stmt, 3, digest.createdAt());
                stmt.executeUpdate();
            }

            try (PreparedStatement stmt = c.prepareStatement("DELETE FROM digest_headlines WHERE digest_id = ?")) {
                stmt.setString(1, digest.digestId());
                stmt.executeUpdate();
            }

            try (PreparedStatement stmt = c.prepareStatement("""
                    INSERT INTO digest_headlines (digest_id, position, headline, source, content_type, url)
                    VALUES (?, ?, ?, ?, ?, ?)
                    """)) {
                int position = 0;
                for (DigestHeadline h : digest.headlines()) {
                    stmt.setString(1, digest.digestId());
                    stmt.setInt(2, position++);
                    stmt.setString(3, h.headline());
                    stmt.setString(4, h.source());
                    stmt.setString(5, h.contentType());
                    stmt.setString(6, h.url());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
        });
    }

    @Override
    public Optional<Digest> find(String digestId) throws SQLException {
        Connection c = db.getConnection();

        double predictedScore;
        Instant createdAt;
        try (PreparedStatement stmt = c.prepareStatement(
                "SELECT predicted_score, created_at FROM digests WHERE digest_id = ?")) {
            stmt.setString(1, digestId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                predictedScore = rs.getDouble("predicted_score");
                createdAt = Rows.instant(rs, "created_at");
            }
        }

        List<DigestHeadline> headlines = new ArrayList<>();
        String sql = """
            SELECT headline, source, content_type, url
            FROM digest_headlines
            WHERE digest_id = ?
            ORDER BY position
            """;
        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, digestId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    headlines.add(new DigestHeadline(
                        rs.getString("headline"),
                        rs.getString("source"),
                        rs.getString("content_type"),
                        rs.getString("url")
                    ));
                }
            }
        }

        return Optional.of(new Digest(digestId, predictedScore, headlines, createdAt));
    }
}

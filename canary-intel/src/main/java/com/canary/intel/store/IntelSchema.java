package com.canary.intel.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Schema of the intelligence database.
 * Changes are additive only: new tables or new nullable columns, never renames.
 * All timestamps are epoch milliseconds.
 */
public final class IntelSchema {

    private static final Logger log = LoggerFactory.getLogger(IntelSchema.class);

    // Current schema version - increment when schema changes
    public static final int CURRENT_VERSION = 3;

    private IntelSchema() {}

    /**
     * Create all tables on a fresh database, or migrate an older one.
     */
    public static void initialize(Connection conn) throws SQLException {
        int currentVersion = getSchemaVersion(conn);

        if (currentVersion == 0) {
            createAllTables(conn);
            setSchemaVersion(conn, CURRENT_VERSION);
            log.info("Created intelligence schema v{}", CURRENT_VERSION);
        } else if (currentVersion < CURRENT_VERSION) {
            migrateSchema(conn, currentVersion, CURRENT_VERSION);
            setSchemaVersion(conn, CURRENT_VERSION);
            log.info("Migrated intelligence schema from v{} to v{}", currentVersion, CURRENT_VERSION);
        } else {
            log.debug("Intelligence schema v{} up to date", currentVersion);
        }
    }

    /**
     * Get the current schema version (0 if none set).
     */
    public static int getSchemaVersion(Connection conn) throws SQLException {
        try (ResultSet rs = conn.getMetaData().getTables(null, null, "schema_version", null)) {
            if (!rs.next()) {
                return 0;
            }
        }

        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
            if (rs.next()) {
                return rs.getInt(1);
            }
        }
        return 0;
    }

    private static void setSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_version (version, applied_at) VALUES (?, ?)")) {
            stmt.setInt(1, version);
            stmt.setLong(2, System.currentTimeMillis());
            stmt.executeUpdate();
        }
    }

    private static void createAllTables(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version INTEGER PRIMARY KEY,
                    applied_at INTEGER NOT NULL
                )
                """);

            // Learned structural patterns, keyed by signature
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS patterns (
                    signature TEXT PRIMARY KEY,
                    coarse_key TEXT NOT NULL,
                    sample_urgency_sum REAL NOT NULL,
                    sample_count REAL NOT NULL,
                    confidence REAL NOT NULL,
                    last_updated INTEGER NOT NULL
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_patterns_coarse ON patterns(coarse_key)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS keyword_weights (
                    term TEXT PRIMARY KEY,
                    weight REAL NOT NULL,
                    sample_count REAL NOT NULL,
                    last_updated INTEGER NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS source_reliability (
                    source TEXT NOT NULL,
                    content_type TEXT NOT NULL,
                    reliability REAL NOT NULL,
                    sample_count REAL NOT NULL,
                    last_updated INTEGER NOT NULL,
                    PRIMARY KEY (source, content_type)
                )
                """);

            // One row per ingested feedback; (kind, feedback_key) enforces at-most-once
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS feedback_records (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    kind TEXT NOT NULL,
                    feedback_key TEXT NOT NULL,
                    rating REAL,
                    irrelevant INTEGER NOT NULL DEFAULT 0,
                    headline TEXT,
                    source TEXT,
                    content_type TEXT,
                    comment TEXT,
                    ai_score REAL,
                    prediction_id TEXT,
                    feedback_type TEXT NOT NULL,
                    created_at INTEGER NOT NULL,
                    UNIQUE (kind, feedback_key)
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_feedback_created ON feedback_records(created_at)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS digests (
                    digest_id TEXT PRIMARY KEY,
                    predicted_score REAL NOT NULL,
                    created_at INTEGER NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS digest_headlines (
                    digest_id TEXT NOT NULL,
                    position INTEGER NOT NULL,
                    headline TEXT NOT NULL,
                    source TEXT NOT NULL,
                    content_type TEXT NOT NULL,
                    url TEXT,
                    PRIMARY KEY (digest_id, position),
                    FOREIGN KEY (digest_id) REFERENCES digests(digest_id)
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS prediction_tracking (
                    prediction_id TEXT PRIMARY KEY,
                    headline TEXT NOT NULL,
                    source TEXT NOT NULL,
                    content_type TEXT NOT NULL,
                    inputs_snapshot TEXT,
                    predicted_score REAL NOT NULL,
                    fallback_used INTEGER NOT NULL DEFAULT 0,
                    predicted_at INTEGER NOT NULL,
                    realized_score REAL,
                    error REAL,
                    realized_at INTEGER
                )
                """);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_predictions_match ON prediction_tracking(headline, source, predicted_at)");

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS false_positives (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    headline TEXT NOT NULL,
                    reason TEXT,
                    predicted_urgency REAL,
                    reported_at INTEGER NOT NULL
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS missed_signals (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    description TEXT NOT NULL,
                    details TEXT,
                    actual_urgency REAL,
                    reported_at INTEGER NOT NULL
                )
                """);
        }
        // Later additions are part of a fresh schema too
        migrateSchema(conn, 1, CURRENT_VERSION);
    }

    /**
     * Migrate schema from one version to another.
     */
    private static void migrateSchema(Connection conn, int fromVersion, int toVersion) throws SQLException {
        for (int v = fromVersion + 1; v <= toVersion; v++) {
            switch (v) {
                case 2 -> migrateToV2(conn);
                case 3 -> migrateToV3(conn);
                default -> log.debug("No migration needed for version {}", v);
            }
        }
    }

    // v2: persisted source decay anchor and the quarantine table
    private static void migrateToV2(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            if (!hasColumn(conn, "source_reliability", "decayed_at")) {
                stmt.execute("ALTER TABLE source_reliability ADD COLUMN decayed_at INTEGER");
            }
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS quarantined_records (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    table_name TEXT NOT NULL,
                    record_key TEXT NOT NULL,
                    payload TEXT NOT NULL,
                    reason TEXT NOT NULL,
                    detected_at INTEGER NOT NULL
                )
                """);
        }
    }

    // v3: insights extracted from feedback comments
    private static void migrateToV3(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS user_insights (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    kind TEXT NOT NULL,
                    feedback_key TEXT NOT NULL,
                    phrase TEXT NOT NULL,
                    context TEXT NOT NULL,
                    corrected_urgency REAL NOT NULL,
                    effectiveness REAL NOT NULL,
                    created_at INTEGER NOT NULL
                )
                """);
        }
    }

    static boolean hasColumn(Connection conn, String table, String column) throws SQLException {
        try (ResultSet rs = conn.getMetaData().getColumns(null, null, table, column)) {
            return rs.next();
        }
    }
}

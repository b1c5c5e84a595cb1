package com.canary.intel.store;

import com.canary.intel.MutableClock;
import com.canary.intel.model.FalsePositive;
import com.canary.intel.model.Pattern;
import com.canary.intel.store.dao.SqliteErrorReportRepo;
import com.canary.intel.store.dao.SqlitePatternRepo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for IntelDatabase transactions and IntelSchema versioning.
 */
class IntelDatabaseTest {

    @TempDir
    Path tempDir;

    private IntelDatabase db;

    @BeforeEach
    void setUp() {
        db = new IntelDatabase(tempDir.resolve("intel.db"), 1000);
        db.initialize();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private static <T> T abort(String message) {
        throw new IllegalStateException(message);
    }

    @Nested
    @DisplayName("Schema")
    class SchemaTests {

        @Test
        @DisplayName("Fresh database is created at the current version")
        void freshSchema() throws SQLException {
            assertEquals(IntelSchema.CURRENT_VERSION, IntelSchema.getSchemaVersion(db.getConnection()));
            assertTrue(IntelSchema.hasColumn(db.getConnection(), "source_reliability", "decayed_at"));
            assertTrue(IntelSchema.hasColumn(db.getConnection(), "quarantined_records", "payload"));
            assertTrue(IntelSchema.hasColumn(db.getConnection(), "user_insights", "phrase"));
        }

        @Test
        @DisplayName("Reopening keeps data and version")
        void reopenKeepsData() throws SQLException {
            new SqliteErrorReportRepo(db).saveFalsePositive(
                new FalsePositive("Rates unchanged", "not urgent", 8.0, MutableClock.T0));
            db.close();

            IntelDatabase reopened = new IntelDatabase(tempDir.resolve("intel.db"), 1000);
            reopened.initialize();
            try {
                assertEquals(1, new SqliteErrorReportRepo(reopened).countFalsePositives());
                assertEquals(IntelSchema.CURRENT_VERSION, IntelSchema.getSchemaVersion(reopened.getConnection()));
            } finally {
                reopened.close();
            }
        }

        @Test
        @DisplayName("Version 1 database gains the decay anchor, quarantine and insight tables")
        void migratesFromVersionOne() throws SQLException {
            IntelDatabase old = new IntelDatabase(tempDir.resolve("v1.db"), 1000);
            try {
                Connection c = old.getConnection();
                try (Statement stmt = c.createStatement()) {
                    stmt.execute("CREATE TABLE schema_version (version INTEGER PRIMARY KEY, applied_at INTEGER NOT NULL)");
                    stmt.execute("INSERT INTO schema_version (version, applied_at) VALUES (1, 0)");
                    stmt.execute("""
                        CREATE TABLE source_reliability (
                            source TEXT NOT NULL,
                            content_type TEXT NOT NULL,
                            reliability REAL NOT NULL,
                            sample_count REAL NOT NULL,
                            last_updated INTEGER NOT NULL,
                            PRIMARY KEY (source, content_type)
                        )
                        """);
                }

                old.initialize();

                assertEquals(IntelSchema.CURRENT_VERSION, IntelSchema.getSchemaVersion(c));
                assertTrue(IntelSchema.hasColumn(c, "source_reliability", "decayed_at"));
                assertTrue(IntelSchema.hasColumn(c, "quarantined_records", "reason"));
                assertTrue(IntelSchema.hasColumn(c, "user_insights", "corrected_urgency"));
            } finally {
                old.close();
            }
        }
    }

    @Nested
    @DisplayName("Transactions")
    class TransactionTests {

        @Test
        @DisplayName("Runtime failure rolls back everything written in the transaction")
        void rollsBackOnRuntimeException() throws SQLException {
            SqliteErrorReportRepo repo = new SqliteErrorReportRepo(db);

            assertThrows(IllegalStateException.class, () -> db.executeInTransaction(c -> {
                repo.saveFalsePositive(new FalsePositive("one", null, null, MutableClock.T0));
                return abort("boom");
            }));

            assertEquals(0, repo.countFalsePositives());
            assertFalse(db.inTransaction());
        }

        @Test
        @DisplayName("Nested call joins the outer transaction")
        void nestedJoinsOuter() throws SQLException {
            SqliteErrorReportRepo repo = new SqliteErrorReportRepo(db);

            assertThrows(IllegalStateException.class, () -> db.executeInTransaction(c -> {
                db.executeInTransaction(inner -> {
                    repo.saveFalsePositive(new FalsePositive("inner", null, null, MutableClock.T0));
                });
                assertTrue(db.inTransaction());
                return abort("outer fails after inner finished");
            }));

            assertEquals(0, repo.countFalsePositives());
        }

        @Test
        @DisplayName("Successful transaction commits")
        void commits() throws SQLException {
            SqliteErrorReportRepo repo = new SqliteErrorReportRepo(db);

            db.executeInTransaction(c -> {
                repo.saveFalsePositive(new FalsePositive("kept", null, 7.5, MutableClock.T0));
            });

            assertEquals(1, repo.countFalsePositives());
        }
    }

    @Nested
    @DisplayName("Forward compatibility")
    class ForwardCompatibilityTests {

        @Test
        @DisplayName("Columns added by a newer schema are tolerated and preserved")
        void toleratesUnknownColumns() throws SQLException {
            Connection c = db.getConnection();
            try (Statement stmt = c.createStatement()) {
                stmt.execute("ALTER TABLE patterns ADD COLUMN analyst_note TEXT");
            }
            SqlitePatternRepo repo = new SqlitePatternRepo(db);
            repo.save(new Pattern("sig", "m=breaking|w=", 16.0, 2.0, 0.38, MutableClock.T0));
            try (Statement stmt = c.createStatement()) {
                stmt.execute("UPDATE patterns SET analyst_note = 'keep me' WHERE signature = 'sig'");
            }

            repo.save(new Pattern("sig", "m=breaking|w=", 24.0, 3.0, 0.475, MutableClock.T0));

            Pattern loaded = repo.find("sig").orElseThrow();
            assertEquals(3.0, loaded.sampleCount());
            try (PreparedStatement stmt = c.prepareStatement("SELECT analyst_note FROM patterns WHERE signature = ?")) {
                stmt.setString(1, "sig");
                try (ResultSet rs = stmt.executeQuery()) {
                    assertTrue(rs.next());
                    assertEquals("keep me", rs.getString(1));
                }
            }
        }
    }
}

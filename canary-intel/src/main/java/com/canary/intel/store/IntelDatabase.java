package com.canary.intel.store;

import com.canary.core.config.StorageSettings;
import com.canary.core.error.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * The single SQLite file holding all learned state (~/.canary/canary_protocol.db).
 * WAL journal, bounded busy wait, IMMEDIATE write transactions.
 * One connection per instance; the engine runs single-threaded per process.
 */
public class IntelDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IntelDatabase.class);

    private final Path dbFile;
    private final int busyTimeoutMs;
    private Connection connection;
    private final Object lock = new Object();

    public IntelDatabase(Path dbFile, int busyTimeoutMs) {
        this.dbFile = dbFile;
        this.busyTimeoutMs = busyTimeoutMs;
    }

    /**
     * Open the database named by the storage settings and bring its schema up to date.
     */
    public static IntelDatabase open(StorageSettings settings) {
        IntelDatabase db = new IntelDatabase(settings.resolveDatabasePath(), settings.getBusyTimeoutMs());
        db.initialize();
        return db;
    }

    /**
     * Create or migrate the schema. Wraps failures into StorageUnavailableException.
     */
    public void initialize() {
        try {
            executeInTransaction(IntelSchema::initialize);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Cannot initialize database " + dbFile, e);
        }
    }

    /**
     * Get or create the SQLite connection.
     */
    public Connection getConnection() throws SQLException {
        synchronized (lock) {
            if (connection == null || connection.isClosed()) {
                connection = createConnection();
            }
            return connection;
        }
    }

    private Connection createConnection() throws SQLException {
        Path parentDir = dbFile.toAbsolutePath().getParent();
        if (parentDir != null) {
            try {
                Files.createDirectories(parentDir);
            } catch (IOException e) {
                throw new SQLException("Cannot create database directory " + parentDir, e);
            }
        }

        Properties props = new Properties();
        // BEGIN IMMEDIATE: a writer takes the write lock up front instead of failing at commit
        props.setProperty("transaction_mode", "IMMEDIATE");

        Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath(), props);

        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA journal_mode=WAL");
            stmt.execute("PRAGMA synchronous=NORMAL");
            stmt.execute("PRAGMA foreign_keys=ON");
            stmt.execute("PRAGMA busy_timeout=" + busyTimeoutMs);
        }

        log.debug("Opened SQLite connection at {}", dbFile.toAbsolutePath());
        return conn;
    }

    /**
     * Execute a function within a transaction.
     * Commits on success, rolls back on any failure (including runtime exceptions
     * such as a rejected duplicate). A call made while a transaction is already
     * open joins it; only the outermost call commits or rolls back.
     */
    public <T> T executeInTransaction(TransactionFunction<T> function) throws SQLException {
        Connection conn = getConnection();
        synchronized (lock) {
            if (!conn.getAutoCommit()) {
                return function.apply(conn);
            }
            try {
                conn.setAutoCommit(false);
                T result = function.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackEx) {
                    log.warn("Rollback failed: {}", rollbackEx.getMessage());
                    e.addSuppressed(rollbackEx);
                }
                throw e;
            } finally {
                try {
                    conn.setAutoCommit(true);
                } catch (SQLException e) {
                    log.warn("Could not restore auto-commit: {}", e.getMessage());
                }
            }
        }
    }

    /**
     * Execute a void function within a transaction.
     */
    public void executeInTransaction(TransactionConsumer consumer) throws SQLException {
        executeInTransaction(conn -> {
            consumer.accept(conn);
            return null;
        });
    }

    public boolean inTransaction() throws SQLException {
        return !getConnection().getAutoCommit();
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (connection != null) {
                try {
                    connection.close();
                    log.debug("Closed SQLite connection at {}", dbFile);
                } catch (SQLException e) {
                    log.warn("Error closing connection at {}: {}", dbFile, e.getMessage());
                }
                connection = null;
            }
        }
    }

    /**
     * Functional interface for transactional operations returning a value.
     */
    @FunctionalInterface
    public interface TransactionFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    /**
     * Functional interface for transactional operations with no return value.
     */
    @FunctionalInterface
    public interface TransactionConsumer {
        void accept(Connection connection) throws SQLException;
    }
}

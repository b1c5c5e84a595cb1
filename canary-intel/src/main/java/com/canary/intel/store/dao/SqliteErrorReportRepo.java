package com.canary.intel.store.dao;

import com.canary.intel.model.FalsePositive;
import com.canary.intel.model.MissedSignal;
import com.canary.intel.store.ErrorReportRepo;
import com.canary.intel.store.IntelDatabase;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * DAO for false positives and missed signals.
 */
public class SqliteErrorReportRepo implements ErrorReportRepo {

    private final IntelDatabase db;

    public SqliteErrorReportRepo(IntelDatabase db) {
        this.db = db;
    }

    @Override
    public void saveFalsePositive(FalsePositive falsePositive) throws SQLException {
        Connection c = db.getConnection();

        String sql = """
            INSERT INTO false_positives (headline, reason, predicted_urgency, reported_at)
            VALUES (?, ?, ?, ?)
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, falsePositive.headline());
            stmt.setString(2, falsePositive.reason());
            Rows.setNullableDouble(stmt, 3, falsePositive.predictedUrgency());
            Rows.setInstant(stmt, 4, falsePositive.reportedAt());
            stmt.executeUpdate();
        }
    }

    @Override
    public void saveMissedSignal(MissedSignal missedSignal) throws SQLException {
        Connection c = db.getConnection();

        String sql = """
            INSERT INTO missed_signals (description, details, actual_urgency, reported_at)
            VALUES (?, ?, ?, ?)
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, missedSignal.description());
            stmt.setString(2, missedSignal.details());
            Rows.setNullableDouble(stmt, 3, missedSignal.actualUrgency());
            Rows.setInstant(stmt, 4, missedSignal.reportedAt());
            stmt.executeUpdate();
        }
    }

    @Override
    public int countFalsePositives() throws SQLException {
        return count("SELECT COUNT(*) FROM false_positives");
    }

    @Override
    public int countMissedSignals() throws SQLException {
        return count("SELECT COUNT(*) FROM missed_signals");
    }

    private int count(String sql) throws SQLException {
        Connection c = db.getConnection();

        try (PreparedStatement stmt = c.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return rs.getInt(1);
            }
        }
        return 0;
    }
}

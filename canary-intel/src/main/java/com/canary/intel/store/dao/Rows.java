package com.canary.intel.store.dao;

import com.canary.core.error.CorruptRecordException;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;

/**
 * Column helpers shared by the DAOs. Corrupt rows are named by their SQLite rowid,
 * so every SELECT that maps rows also selects {@code rowid AS row_id}.
 */
final class Rows {

    static final String ROW_ID = "row_id";

    private Rows() {}

    static Instant instant(ResultSet rs, String column) throws SQLException {
        long millis = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setLong(index, value.toEpochMilli());
        }
    }

    static void setNullableDouble(PreparedStatement stmt, int index, Double value) throws SQLException {
        if (value == null || value.isNaN()) {
            stmt.setNull(index, Types.REAL);
        } else {
            stmt.setDouble(index, value);
        }
    }

    /**
     * Read a required REAL column; NULL, NaN and values outside [min, max] are corrupt.
     */
    static double requireDouble(ResultSet rs, String table, String column, double min, double max)
            throws SQLException {
        double value = rs.getDouble(column);
        if (rs.wasNull() || Double.isNaN(value) || value < min || value > max) {
            throw corrupt(rs, table, column + " out of range: " + (rs.wasNull() ? "null" : value));
        }
        return value;
    }

    static String requireText(ResultSet rs, String table, String column) throws SQLException {
        String value = rs.getString(column);
        if (value == null || value.isBlank()) {
            throw corrupt(rs, table, column + " is empty");
        }
        return value;
    }

    static Instant requireInstant(ResultSet rs, String table, String column) throws SQLException {
        Instant value = instant(rs, column);
        if (value == null) {
            throw corrupt(rs, table, column + " is missing");
        }
        return value;
    }

    static CorruptRecordException corrupt(ResultSet rs, String table, String reason) throws SQLException {
        return new CorruptRecordException(table, Long.toString(rs.getLong(ROW_ID)), reason);
    }
}

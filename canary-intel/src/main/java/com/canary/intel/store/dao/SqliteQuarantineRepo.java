package com.canary.intel.store.dao;

import com.canary.core.error.CorruptRecordException;
import com.canary.intel.model.QuarantinedRecord;
import com.canary.intel.store.IntelDatabase;
import com.canary.intel.store.QuarantineRepo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * DAO for quarantined rows. The original row is kept verbatim as a JSON object of its columns.
 */
public class SqliteQuarantineRepo implements QuarantineRepo {

    private static final Logger log = LoggerFactory.getLogger(SqliteQuarantineRepo.class);

    // Table names are spliced into SQL, so only known tables are accepted
    private static final Set<String> QUARANTINABLE = Set.of(
        SqlitePatternRepo.TABLE,
        SqliteKeywordRepo.TABLE,
        SqliteSourceRepo.TABLE,
        SqlitePredictionRepo.TABLE
    );

    private final IntelDatabase db;
    private final ObjectMapper mapper = new ObjectMapper();

    public SqliteQuarantineRepo(IntelDatabase db) {
        this.db = db;
    }

    @Override
    public boolean quarantine(CorruptRecordException corrupt, Instant detectedAt) throws SQLException {
        String table = corrupt.getTable();
        if (!QUARANTINABLE.contains(table)) {
            throw new IllegalArgumentException("Not a quarantinable table: " + table);
        }
        long rowId = Long.parseLong(corrupt.getRecordKey());
        Connection c = db.getConnection();

        Map<String, Object> row = new LinkedHashMap<>();
        try (PreparedStatement stmt = c.prepareStatement("SELECT * FROM " + table + " WHERE rowid = ?")) {
            stmt.setLong(1, rowId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return false;
                }
                ResultSetMetaData meta = rs.getMetaData();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    row.put(meta.getColumnLabel(i), rs.getObject(i));
                }
            }
        }

        String payload;
        try {
            payload = mapper.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            payload = row.toString();
        }

        try (PreparedStatement stmt = c.prepareStatement("""
                INSERT INTO quarantined_records (table_name, record_key, payload, reason, detected_at)
                VALUES (?, ?, ?, ?, ?)
                """)) {
            stmt.setString(1, table);
            stmt.setString(2, corrupt.getRecordKey());
            stmt.setString(3, payload);
            stmt.setString(4, corrupt.getReason());
            Rows.setInstant(stmt, 5, detectedAt);
            stmt.executeUpdate();
        }

        try (PreparedStatement stmt = c.prepareStatement("DELETE FROM " + table + " WHERE rowid = ?")) {
            stmt.setLong(1, rowId);
            stmt.executeUpdate();
        }

        log.warn("Quarantined corrupt row {} from {}: {}", rowId, table, corrupt.getReason());
        return true;
    }

    @Override
    public List<QuarantinedRecord> findAll() throws SQLException {
        Connection c = db.getConnection();
        List<QuarantinedRecord> records = new ArrayList<>();

        String sql = """
            SELECT table_name, record_key, payload, reason, detected_at
            FROM quarantined_records
            ORDER BY id
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                records.add(new QuarantinedRecord(
                    rs.getString("table_name"),
                    rs.getString("record_key"),
                    rs.getString("payload"),
                    rs.getString("reason"),
                    Rows.instant(rs, "detected_at")
                ));
            }
        }
        return records;
    }

    @Override
    public int count() throws SQLException {
        Connection c = db.getConnection();

        try (PreparedStatement stmt = c.prepareStatement("SELECT COUNT(*) FROM quarantined_records");
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return rs.getInt(1);
            }
        }
        return 0;
    }
}

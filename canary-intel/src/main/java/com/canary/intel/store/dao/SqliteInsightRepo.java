package com.canary.intel.store.dao;

import com.canary.intel.model.FeedbackRecord;
import com.canary.intel.model.UserInsight;
import com.canary.intel.store.InsightRepo;
import com.canary.intel.store.IntelDatabase;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO for user insights.
 */
public class SqliteInsightRepo implements InsightRepo {

    private final IntelDatabase db;

    public SqliteInsightRepo(IntelDatabase db) {
        this.db = db;
    }

    @Override
    public void save(UserInsight insight) throws SQLException {
        Connection c = db.getConnection();

        String sql = """
            INSERT INTO user_insights
                (kind, feedback_key, phrase, context, corrected_urgency, effectiveness, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, insight.kind().name());
            stmt.setString(2, insight.feedbackKey());
            stmt.setString(3, insight.phrase());
            stmt.setString(4, insight.context());
            stmt.setDouble(5, insight.correctedUrgency());
            stmt.setDouble(6, insight.effectiveness());
            Rows.setInstant(stmt, 7, insight.createdAt());
            stmt.executeUpdate();
        }
    }

    @Override
    public List<UserInsight> findAll() throws SQLException {
        Connection c = db.getConnection();
        List<UserInsight> insights = new ArrayList<>();

        String sql = """
            SELECT kind, feedback_key, phrase, context, corrected_urgency, effectiveness, created_at
            FROM user_insights
            ORDER BY id
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                insights.add(new UserInsight(
                    FeedbackRecord.FeedbackKind.valueOf(rs.getString("kind")),
                    rs.getString("feedback_key"),
                    rs.getString("phrase"),
                    rs.getString("context"),
                    rs.getDouble("corrected_urgency"),
                    rs.getDouble("effectiveness"),
                    Rows.instant(rs, "created_at")
                ));
            }
        }
        return insights;
    }

    @Override
    public int count() throws SQLException {
        Connection c = db.getConnection();

        try (PreparedStatement stmt = c.prepareStatement("SELECT COUNT(*) FROM user_insights");
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return rs.getInt(1);
            }
        }
        return 0;
    }
}

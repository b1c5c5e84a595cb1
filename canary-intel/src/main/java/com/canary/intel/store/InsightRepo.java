package com.canary.intel.store;

import com.canary.intel.model.UserInsight;

import java.sql.SQLException;
import java.util.List;

/**
 * Insights extracted from feedback comments.
 */
public interface InsightRepo {

    void save(UserInsight insight) throws SQLException;

    /**
     * All insights in the order they were recorded.
     */
    List<UserInsight> findAll() throws SQLException;

    int count() throws SQLException;
}

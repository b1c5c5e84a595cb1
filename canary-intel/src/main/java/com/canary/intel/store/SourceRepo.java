package com.canary.intel.store;

import com.canary.intel.model.SourceReliability;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

public interface SourceRepo extends RecordTable {

    Optional<SourceReliability> find(String source, String contentType) throws SQLException;

    /**
     * All sources ordered by source then content type.
     */
    List<SourceReliability> findAll() throws SQLException;

    void save(SourceReliability reliability) throws SQLException;
}

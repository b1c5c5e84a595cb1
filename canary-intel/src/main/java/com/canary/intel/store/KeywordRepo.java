package com.canary.intel.store;

import com.canary.intel.model.KeywordWeight;

import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface KeywordRepo extends RecordTable {

    Optional<KeywordWeight> find(String term) throws SQLException;

    /**
     * Known weights for the given terms, keyed by term. Unknown and corrupt terms are absent.
     */
    Map<String, KeywordWeight> findAll(Collection<String> terms) throws SQLException;

    /**
     * Heaviest keywords first, ties broken by term.
     */
    List<KeywordWeight> findTop(int limit) throws SQLException;

    void save(KeywordWeight weight) throws SQLException;

    int count() throws SQLException;
}

package com.canary.intel.store;

import com.canary.intel.model.Digest;

import java.sql.SQLException;
import java.util.Optional;

public interface DigestRepo {

    /**
     * Store a digest and its headlines, replacing any earlier registration of the same id.
     */
    void save(Digest digest) throws SQLException;

    Optional<Digest> find(String digestId) throws SQLException;
}

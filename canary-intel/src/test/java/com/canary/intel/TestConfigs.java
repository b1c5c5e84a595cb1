package com.canary.intel;

import com.canary.core.config.IntelConfig;

import java.nio.file.Path;

public final class TestConfigs {

    private TestConfigs() {}

    /**
     * Bundled defaults with storage pointed into the given directory.
     */
    public static IntelConfig inDirectory(Path dir) {
        IntelConfig config = IntelConfig.defaults();
        config.getStorage().setDatabasePath(dir.resolve("canary_protocol.db").toString());
        config.getStorage().setLockDir(dir.resolve("locks").toString());
        return config;
    }
}

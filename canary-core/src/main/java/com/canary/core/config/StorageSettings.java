package com.canary.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.nio.file.Path;

/**
 * Where the learning database and job lock files live.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageSettings {

    private String databasePath = "~/.canary/canary_protocol.db";
    private String lockDir = "~/.canary/locks";
    private int busyTimeoutMs = 5000;               // bounded wait on a locked database

    /**
     * Database path with a leading ~ expanded to the user home.
     */
    public Path resolveDatabasePath() {
        return expandHome(databasePath);
    }

    public Path resolveLockDir() {
        return expandHome(lockDir);
    }

    static Path expandHome(String path) {
        if (path.startsWith("~/")) {
            return Path.of(System.getProperty("user.home"), path.substring(2));
        }
        return Path.of(path);
    }

    public String getDatabasePath() {
        return databasePath;
    }

    public void setDatabasePath(String databasePath) {
        this.databasePath = databasePath;
    }

    public String getLockDir() {
        return lockDir;
    }

    public void setLockDir(String lockDir) {
        this.lockDir = lockDir;
    }

    public int getBusyTimeoutMs() {
        return busyTimeoutMs;
    }

    public void setBusyTimeoutMs(int busyTimeoutMs) {
        this.busyTimeoutMs = busyTimeoutMs;
    }
}

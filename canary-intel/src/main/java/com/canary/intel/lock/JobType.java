package com.canary.intel.lock;

import java.util.Locale;

/**
 * Batch jobs that must not overlap with themselves.
 */
public enum JobType {
    DAILY_COLLECTION,
    WEEKLY_DIGEST,
    FEEDBACK_SESSION,
    LEARNING_MAINTENANCE;

    /**
     * Lock file name, e.g. "learning_maintenance.lock".
     */
    public String lockFileName() {
        return name().toLowerCase(Locale.ROOT) + ".lock";
    }
}

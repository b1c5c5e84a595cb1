package com.canary.intel.feedback;

public enum LearningStatus {
    ACTIVE,
    WAITING_FOR_FEEDBACK
}

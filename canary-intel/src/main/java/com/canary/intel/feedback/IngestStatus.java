package com.canary.intel.feedback;

/**
 * Terminal state of one ingestion. A received record is validated and then either
 * applied or rejected; rejected records change nothing.
 */
public enum IngestStatus {
    APPLIED,
    REJECTED_DUPLICATE,
    REJECTED_INVALID
}

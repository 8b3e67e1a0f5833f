package com.fairway.common.batch;

/** Per-item result of a batch job. */
public enum OutcomeStatus {
    SUCCEEDED,
    FAILED,
    /** The batch was cancelled before this item started. */
    CANCELLED
}

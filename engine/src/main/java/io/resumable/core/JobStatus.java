package io.resumable.core;

/**
 * Lifecycle of a job as recorded in its checkpoint.
 */
public enum JobStatus {
    NEW,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    /** Terminal jobs are never run or re-armed again. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}

package io.resumable.core;

/**
 * Outcome of a single bounded invocation of the scheduler.
 */
public enum RunStatus {
    COMPLETED,
    PAUSED,
    FAILED,
    /** The invocation did nothing and left the checkpoint untouched (lock or persistence trouble). */
    SKIPPED
}

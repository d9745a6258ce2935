package io.resumable.core;

/**
 * What a job does when an item fails fatally or exhausts its retries.
 */
public enum FailurePolicy {
    /** Record the failure, advance past the item and keep going. */
    SKIP_AND_CONTINUE,
    /** Stop the whole job in FAILED. */
    ABORT_JOB
}

package io.resumable.core;

public enum StopReason {
    NONE,
    TIME_BUDGET,
    QUOTA_EXCEEDED,
    CIRCUIT_OPEN,
    ITEM_FAILED,
    CANCELLED,
    LOCK_UNAVAILABLE,
    PERSISTENCE_ERROR,
    SOURCE_UNAVAILABLE,
    UNKNOWN_JOB
}

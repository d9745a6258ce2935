package io.resumable.retry;

import io.resumable.core.StopReason;

/**
 * Result of running one call through {@link RetryExecutor}. Exactly one of the three kinds; {@code attempts}
 * counts the calls that actually reached the work function.
 */
public final class AttemptOutcome<T> {
    public enum Kind { SUCCEEDED, FAILED, BLOCKED }

    private final Kind kind;
    private final T value;
    private final Throwable error;
    private final ErrorClass errorClass;
    private final StopReason blockedBy;
    private final int attempts;

    private AttemptOutcome(Kind kind, T value, Throwable error, ErrorClass errorClass, StopReason blockedBy, int attempts) {
        this.kind = kind;
        this.value = value;
        this.error = error;
        this.errorClass = errorClass;
        this.blockedBy = blockedBy;
        this.attempts = attempts;
    }

    static <T> AttemptOutcome<T> succeeded(T value, int attempts) {
        return new AttemptOutcome<>(Kind.SUCCEEDED, value, null, null, StopReason.NONE, attempts);
    }

    static <T> AttemptOutcome<T> failed(Throwable error, ErrorClass errorClass, int attempts) {
        return new AttemptOutcome<>(Kind.FAILED, null, error, errorClass, StopReason.NONE, attempts);
    }

    static <T> AttemptOutcome<T> blocked(StopReason reason, Throwable lastError, int attempts) {
        return new AttemptOutcome<>(Kind.BLOCKED, null, lastError, null, reason, attempts);
    }

    public Kind kind() { return kind; }
    public boolean succeeded() { return kind == Kind.SUCCEEDED; }
    public T value() { return value; }
    /** Last error seen; null on success, possibly null when blocked before any attempt. */
    public Throwable error() { return error; }
    public ErrorClass errorClass() { return errorClass; }
    public StopReason blockedBy() { return blockedBy; }
    public int attempts() { return attempts; }

    @Override
    public String toString() {
        return "AttemptOutcome{" + kind + ", attempts=" + attempts
                + (error != null ? ", error=" + error : "")
                + (blockedBy != StopReason.NONE ? ", blockedBy=" + blockedBy : "") + '}';
    }
}

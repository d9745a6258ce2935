package io.resumable.retry;

import io.resumable.core.StopReason;

/**
 * Hooks the caller's admission checks around every single attempt, retries included, so each call that
 * reaches a dependency is charged to its quota and reported to its circuit breaker.
 */
public interface AttemptGuard {
    AttemptGuard NONE = new AttemptGuard() {};

    /** Returns {@link StopReason#NONE} to let attempt {@code attempt} (1-based) go ahead. */
    default StopReason beforeAttempt(int attempt) { return StopReason.NONE; }

    /** Called after each attempt; {@code error} is null on success. */
    default void afterAttempt(int attempt, Throwable error, ErrorClass errorClass) {}
}

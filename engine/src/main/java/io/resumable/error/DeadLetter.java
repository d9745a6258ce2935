package io.resumable.error;

import io.resumable.retry.ErrorClass;

import java.time.Instant;

/**
 * An item the scheduler gave up on.
 */
public record DeadLetter(
        String jobId,
        long offset,
        String error,
        ErrorClass errorClass,
        int attempts,
        Instant at
) {
    public static DeadLetter of(String jobId, long offset, Throwable error, ErrorClass errorClass, int attempts, Instant at) {
        return new DeadLetter(jobId, offset, error == null ? "unknown" : error.toString(), errorClass, attempts, at);
    }
}

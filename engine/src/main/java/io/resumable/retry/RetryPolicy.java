package io.resumable.retry;

public interface RetryPolicy {
    /** Whether another attempt may follow {@code attempt} (1-based) that failed with {@code e}. */
    boolean shouldRetry(int attempt, Throwable e);

    /** Delay before the attempt that follows {@code attempt}. */
    long backoffMillis(int attempt);
}

package io.resumable.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Up to {@code maxRetries} retries after the first attempt. The n-th retry (0-based) waits
 * {@code min(base * 2^n * jitter, max)} with jitter uniform in [0.5, 1.0].
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxRetries;
    private final long baseMillis;
    private final long maxMillis;
    private final DoubleSupplier random;

    public ExponentialBackoffRetryPolicy(int maxRetries, long baseMillis, long maxMillis) {
        this(maxRetries, baseMillis, maxMillis, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in [0, 1), mapped onto the jitter range
     */
    public ExponentialBackoffRetryPolicy(int maxRetries, long baseMillis, long maxMillis, DoubleSupplier random) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.random = random;
    }

    public int maxRetries() { return maxRetries; }

    @Override
    public boolean shouldRetry(int attempt, Throwable e) {
        return attempt <= maxRetries;
    }

    @Override
    public long backoffMillis(int attempt) {
        int retryIndex = Math.max(0, attempt - 1);
        long delay = baseMillis * (1L << Math.min(30, retryIndex));
        double jitter = 0.5 + 0.5 * Math.min(1.0, Math.max(0.0, random.getAsDouble()));
        return Math.min((long) (delay * jitter), maxMillis);
    }
}

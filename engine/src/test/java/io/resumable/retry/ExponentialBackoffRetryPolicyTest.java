package io.resumable.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExponentialBackoffRetryPolicyTest {
    @Test
    void backoff_doubles_within_jitter_bounds() {
        ExponentialBackoffRetryPolicy low = new ExponentialBackoffRetryPolicy(5, 100, 10_000, () -> 0.0);
        ExponentialBackoffRetryPolicy high = new ExponentialBackoffRetryPolicy(5, 100, 10_000, () -> 0.999999);
        for (int attempt = 1; attempt <= 5; attempt++) {
            long full = 100L << (attempt - 1);
            assertEquals(full / 2, low.backoffMillis(attempt));
            long h = high.backoffMillis(attempt);
            assertTrue(h <= full && h >= full - 1, "attempt " + attempt + " was " + h);
        }
    }

    @Test
    void backoff_never_exceeds_max() {
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(50, 100, 2_000);
        for (int attempt = 1; attempt <= 50; attempt++) {
            long b = policy.backoffMillis(attempt);
            assertTrue(b >= 0 && b <= 2_000, "attempt " + attempt + " was " + b);
        }
    }

    @Test
    void retries_bounded_by_max_retries() {
        ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(2, 10, 100);
        assertTrue(policy.shouldRetry(1, new RuntimeException()));
        assertTrue(policy.shouldRetry(2, new RuntimeException()));
        assertFalse(policy.shouldRetry(3, new RuntimeException()));
    }
}

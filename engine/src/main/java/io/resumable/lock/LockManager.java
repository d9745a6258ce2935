package io.resumable.lock;

import java.time.Duration;

/**
 * Advisory, non-reentrant named locks with a bounded wait.
 */
public interface LockManager {
    /** Waits at most {@code maxWait}; returns false when the lock could not be taken in time. */
    boolean acquire(String lockName, Duration maxWait) throws InterruptedException;

    void release(String lockName);
}

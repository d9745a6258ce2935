package io.resumable.lock;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Process-local locks. Backed by single-permit semaphores, so a lock taken on one thread may be released on
 * another (trigger threads hand work around).
 */
public class InMemoryLockManager implements LockManager {
    private final Map<String, Semaphore> locks = new ConcurrentHashMap<>();

    @Override
    public boolean acquire(String lockName, Duration maxWait) throws InterruptedException {
        Semaphore s = locks.computeIfAbsent(lockName, n -> new Semaphore(1));
        long waitNanos = maxWait == null ? 0 : Math.max(0, maxWait.toNanos());
        return s.tryAcquire(waitNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void release(String lockName) {
        Semaphore s = locks.get(lockName);
        if (s == null) throw new IllegalStateException("lock " + lockName + " was never acquired");
        if (s.availablePermits() > 0) throw new IllegalStateException("lock " + lockName + " is not held");
        s.release();
    }

    public boolean isHeld(String lockName) {
        Semaphore s = locks.get(lockName);
        return s != null && s.availablePermits() == 0;
    }
}

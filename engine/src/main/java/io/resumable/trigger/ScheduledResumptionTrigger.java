package io.resumable.trigger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Timer-backed trigger on a daemon scheduler. At most one pending resumption per job: re-arming cancels the
 * previous one instead of stacking another.
 */
public class ScheduledResumptionTrigger implements ResumptionTrigger, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ScheduledResumptionTrigger.class);

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();
    private final AtomicReference<JobLauncher> launcher = new AtomicReference<>();

    public ScheduledResumptionTrigger() {
        this(Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
            @Override public Thread newThread(Runnable r) { Thread t = new Thread(r, "resumption-trigger"); t.setDaemon(true); return t; }
        }), true);
    }

    public ScheduledResumptionTrigger(ScheduledExecutorService scheduler) {
        this(scheduler, false);
    }

    private ScheduledResumptionTrigger(ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    /** Sets who gets called when a resumption fires. Usually the scheduler's {@code resume}. */
    public ScheduledResumptionTrigger launchWith(JobLauncher l) {
        launcher.set(l);
        return this;
    }

    public boolean hasLauncher() {
        return launcher.get() != null;
    }

    @Override
    public synchronized void schedule(Duration delay, String jobId) {
        long millis = delay == null ? 0 : Math.max(0, delay.toMillis());
        ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
        self[0] = scheduler.schedule(() -> fire(jobId, self), millis, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = pending.put(jobId, self[0]);
        if (previous != null) {
            previous.cancel(false);
            log.debug("Re-armed resumption for job {} in {} ms", jobId, millis);
        } else {
            log.debug("Armed resumption for job {} in {} ms", jobId, millis);
        }
    }

    @Override
    public synchronized void cancelPending(String jobId) {
        ScheduledFuture<?> f = pending.remove(jobId);
        if (f != null) f.cancel(false);
    }

    @Override
    public boolean isPending(String jobId) {
        return pending.containsKey(jobId);
    }

    private void fire(String jobId, ScheduledFuture<?>[] self) {
        synchronized (this) {
            // a newer arming replaced us after we started; leave it in place
            if (pending.get(jobId) != self[0]) return;
            pending.remove(jobId);
        }
        JobLauncher l = launcher.get();
        if (l == null) {
            log.warn("Resumption for job {} fired with no launcher attached", jobId);
            return;
        }
        try {
            l.launch(jobId);
        } catch (Exception e) {
            log.error("Resuming job {} failed", jobId, e);
        }
    }

    @Override
    public void close() {
        pending.values().forEach(f -> f.cancel(false));
        pending.clear();
        if (ownsScheduler) scheduler.shutdownNow();
    }
}

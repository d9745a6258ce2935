package io.resumable.scheduler;

import com.codahale.metrics.Timer;
import io.resumable.checkpoint.Checkpoint;
import io.resumable.checkpoint.CheckpointStore;
import io.resumable.checkpoint.CheckpointStoreException;
import io.resumable.circuit.CircuitBreaker;
import io.resumable.core.FailurePolicy;
import io.resumable.core.JobDefinition;
import io.resumable.core.JobOptions;
import io.resumable.core.JobStatus;
import io.resumable.core.RunResult;
import io.resumable.core.StopReason;
import io.resumable.error.DeadLetter;
import io.resumable.error.DeadLetterSink;
import io.resumable.lock.LockManager;
import io.resumable.metrics.Metrics;
import io.resumable.quota.QuotaExceededException;
import io.resumable.quota.QuotaTracker;
import io.resumable.retry.AttemptOutcome;
import io.resumable.retry.ErrorClassifier;
import io.resumable.retry.RetryExecutor;
import io.resumable.trigger.ResumptionTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs jobs in bounded invocations. Each call to {@link #run} processes items in offset order until the job
 * completes, fails, or has to stop (time budget, quota, open circuit), in which case it checkpoints, arms a
 * resumption and returns. Nothing below this class escapes as an exception: every outcome is a
 * {@link RunResult}.
 */
public class BatchScheduler {
    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private final CheckpointStore checkpoints;
    private final QuotaTracker quota;
    private final CircuitBreaker breaker;
    private final RetryExecutor retry;
    private final ErrorClassifier classifier;
    private final LockManager locks;
    private final Duration lockWait;
    private final ResumptionTrigger trigger;
    private final JobRegistry registry;
    private final DeadLetterSink deadLetters;
    private final Metrics metrics;
    private final Clock clock;
    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    BatchScheduler(CheckpointStore checkpoints,
                   QuotaTracker quota,
                   CircuitBreaker breaker,
                   RetryExecutor retry,
                   ErrorClassifier classifier,
                   LockManager locks,
                   Duration lockWait,
                   ResumptionTrigger trigger,
                   JobRegistry registry,
                   DeadLetterSink deadLetters,
                   Metrics metrics,
                   Clock clock) {
        this.checkpoints = checkpoints;
        this.quota = quota;
        this.breaker = breaker;
        this.retry = retry;
        this.classifier = classifier;
        this.locks = locks;
        this.lockWait = lockWait;
        this.trigger = trigger;
        this.registry = registry;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.clock = clock;
    }

    public static BatchSchedulerBuilder builder() {
        return new BatchSchedulerBuilder();
    }

    /**
     * Registers the job (so resumptions can find it) and runs it for at most its time budget.
     */
    public <T> RunResult run(JobDefinition<T> job) {
        // time spent waiting for the lock counts against the budget
        Instant started = clock.instant();
        registry.register(job);
        String jobId = job.id();
        String lockName = lockName(jobId);
        boolean acquired;
        try {
            acquired = locks.acquire(lockName, lockWait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            acquired = false;
        }
        if (!acquired) {
            log.info("Job {} is already running elsewhere; skipping this invocation", jobId);
            metrics.counter(Metrics.RUNS_SKIPPED).inc();
            return RunResult.skipped(jobId, StopReason.LOCK_UNAVAILABLE, null);
        }
        try (Timer.Context ignored = metrics.timer(Metrics.RUN_TIME).time()) {
            return runLocked(job, started);
        } catch (CheckpointStoreException e) {
            log.error("Persistence failed for job {}; returning without further changes", jobId, e);
            metrics.counter(Metrics.RUNS_SKIPPED).inc();
            arm(jobId, job.options().resumeDelay());
            return RunResult.skipped(jobId, StopReason.PERSISTENCE_ERROR, null);
        } finally {
            // a request this run did not get to honour must not outlive it
            cancelRequested.remove(jobId);
            locks.release(lockName);
        }
    }

    /** Entry point for resumption triggers. */
    public RunResult resume(String jobId) {
        Optional<JobDefinition<?>> job = registry.find(jobId);
        if (job.isEmpty()) {
            log.warn("Resumption fired for unknown job {}", jobId);
            return RunResult.skipped(jobId, StopReason.UNKNOWN_JOB, null);
        }
        return run(job.get());
    }

    /**
     * Marks the job CANCELLED and disarms its trigger. Returns false when there is nothing left to cancel
     * (never run, or already ended) and when the job is running right now; a running job stops at its
     * next item boundary.
     */
    public boolean cancel(String jobId) {
        cancelRequested.add(jobId);
        trigger.cancelPending(jobId);
        String lockName = lockName(jobId);
        boolean acquired;
        try {
            acquired = locks.acquire(lockName, lockWait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelRequested.remove(jobId);
            return false;
        }
        if (!acquired) return false;
        try {
            cancelRequested.remove(jobId);
            trigger.cancelPending(jobId);
            Optional<Checkpoint> live = checkpoints.load(jobId);
            if (live.isEmpty()) {
                log.info("Job {} has no live checkpoint; nothing to cancel", jobId);
                return false;
            }
            Checkpoint cp = live.get();
            registry.unregister(jobId);
            if (cp.status().isTerminal()) {
                log.info("Job {} already ended {}; nothing to cancel", jobId, cp.status());
                return false;
            }
            checkpoints.save(cp.transition(JobStatus.CANCELLED, StopReason.CANCELLED, null, clock.instant()));
            log.info("Job {} cancelled", jobId);
            return true;
        } finally {
            locks.release(lockName);
        }
    }

    /**
     * Forgets all progress of the job so the next run starts from offset 0. The only way an offset moves
     * backwards.
     */
    public boolean restart(String jobId) {
        String lockName = lockName(jobId);
        boolean acquired;
        try {
            acquired = locks.acquire(lockName, lockWait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (!acquired) return false;
        try {
            trigger.cancelPending(jobId);
            cancelRequested.remove(jobId);
            checkpoints.delete(jobId);
            checkpoints.deleteArchived(jobId);
            log.info("Job {} restarted from scratch", jobId);
            return true;
        } finally {
            locks.release(lockName);
        }
    }

    /**
     * Live checkpoint, or the archived one for completed jobs. Without {@code archiveOnComplete} the archived
     * record carries no counters.
     */
    public Optional<Checkpoint> status(String jobId) {
        Optional<Checkpoint> live = checkpoints.load(jobId);
        return live.isPresent() ? live : checkpoints.loadArchived(jobId);
    }

    private <T> RunResult runLocked(JobDefinition<T> job, Instant started) {
        String jobId = job.id();
        JobOptions opts = job.options();

        Optional<Checkpoint> stored = checkpoints.load(jobId);
        if (stored.isEmpty()) {
            // completed earlier, possibly while this invocation waited for the lock
            stored = checkpoints.loadArchived(jobId);
        }
        Checkpoint cp = stored.orElseGet(() -> Checkpoint.initial(jobId, started));
        if (cp.status().isTerminal()) {
            trigger.cancelPending(jobId);
            registry.unregister(jobId);
            return terminalResult(cp);
        }

        long size;
        try {
            size = job.source().size();
        } catch (Exception e) {
            log.warn("Cannot size work source of job {}; will retry later", jobId, e);
            return pause(cp, StopReason.SOURCE_UNAVAILABLE, opts.resumeDelay(), 0);
        }

        cp = cp.transition(JobStatus.RUNNING, StopReason.NONE, null, started).increment(Checkpoint.RUNS, 1);
        if (cp.nextOffset() >= size) {
            if (cp.lastCompletedOffset() >= size) {
                log.info("Work source of job {} shrank to {} items, below offset {}; treating as complete",
                        jobId, size, cp.lastCompletedOffset());
            }
            return complete(cp, opts, 0);
        }
        checkpoints.save(cp);
        log.info("Job {} running from offset {} of {}", jobId, cp.nextOffset(), size);

        ItemGuard guard = new ItemGuard(opts, quota, breaker, clock, started);
        long done = 0;
        int sinceSave = 0;
        for (long offset = cp.nextOffset(); offset < size; offset++) {
            if (cancelRequested.remove(jobId)) {
                return cancelled(cp, done);
            }
            if (budgetExhausted(started, clock.instant(), opts)) {
                return pause(cp, StopReason.TIME_BUDGET, opts.resumeDelay(), done);
            }

            T item;
            try {
                item = job.source().get(offset);
            } catch (Exception e) {
                log.warn("Cannot read item {} of job {}; will retry later", offset, jobId, e);
                return pause(cp, StopReason.SOURCE_UNAVAILABLE, opts.resumeDelay(), done);
            }

            final long current = offset;
            final T currentItem = item;
            AttemptOutcome<Void> outcome;
            try (Timer.Context ignored = metrics.timer(Metrics.ITEM_TIME).time()) {
                outcome = retry.execute(() -> {
                    job.work().process(current, currentItem);
                    return null;
                }, classifier, guard);
            }

            int retries = Math.max(0, outcome.attempts() - 1);
            if (retries > 0) {
                cp = cp.increment(Checkpoint.RETRIES, retries);
                metrics.counter(Metrics.RETRIES).inc(retries);
            }

            switch (outcome.kind()) {
                case SUCCEEDED -> {
                    cp = cp.advanceTo(offset, clock.instant()).increment(Checkpoint.PROCESSED, 1);
                    metrics.meter(Metrics.ITEMS_PROCESSED).mark();
                    done++;
                    sinceSave++;
                }
                case BLOCKED -> {
                    StopReason reason = outcome.blockedBy();
                    return pause(cp, reason, resumeDelay(reason, opts, outcome.error()), done);
                }
                case FAILED -> {
                    Instant now = clock.instant();
                    cp = cp.increment(Checkpoint.FAILED, 1);
                    metrics.meter(Metrics.ITEMS_FAILED).mark();
                    log.warn("Item {} of job {} failed after {} attempt(s): {}", offset, jobId, outcome.attempts(), String.valueOf(outcome.error()));
                    deadLetters.acceptFailure(DeadLetter.of(jobId, offset, outcome.error(), outcome.errorClass(), outcome.attempts(), now));
                    if (opts.failurePolicy() == FailurePolicy.ABORT_JOB) {
                        return fail(cp, done);
                    }
                    cp = cp.advanceTo(offset, now).increment(Checkpoint.SKIPPED, 1);
                    metrics.meter(Metrics.ITEMS_SKIPPED).mark();
                    sinceSave++;
                }
            }

            if (sinceSave >= opts.checkpointEvery()) {
                cp = cp.transition(JobStatus.RUNNING, StopReason.NONE, null, clock.instant());
                checkpoints.save(cp);
                sinceSave = 0;
            }
        }
        return complete(cp, opts, done);
    }

    static boolean budgetExhausted(Instant started, Instant now, JobOptions opts) {
        return Duration.between(started, now).compareTo(opts.workingBudget()) >= 0;
    }

    private Duration resumeDelay(StopReason reason, JobOptions opts, Throwable error) {
        Instant now = clock.instant();
        Duration delay = switch (reason) {
            case QUOTA_EXCEEDED -> {
                Instant resetAt = null;
                if (error instanceof QuotaExceededException qe && qe.resetAt() != null) {
                    resetAt = qe.resetAt();
                } else if (opts.quotaBudget() != null) {
                    resetAt = quota.nextReset(opts.quotaBudget());
                }
                yield resetAt == null ? opts.resumeDelay() : Duration.between(now, resetAt);
            }
            case CIRCUIT_OPEN -> opts.dependency() == null ? opts.resumeDelay() : breaker.retryAfter(opts.dependency());
            default -> opts.resumeDelay();
        };
        return delay.isNegative() ? Duration.ZERO : delay;
    }

    private RunResult pause(Checkpoint cp, StopReason reason, Duration delay, long done) {
        if (cancelRequested.remove(cp.jobId())) {
            return cancelled(cp, done);
        }
        Instant now = clock.instant();
        Checkpoint paused = cp.transition(JobStatus.PAUSED, reason, now.plus(delay), now);
        checkpoints.save(paused);
        arm(paused.jobId(), delay);
        metrics.pauses(reason).inc();
        log.info("Job {} paused at offset {} ({}); resuming in {}", paused.jobId(), paused.lastCompletedOffset(), reason, delay);
        return RunResult.paused(paused, reason, delay, done);
    }

    private RunResult fail(Checkpoint cp, long done) {
        Checkpoint failed = cp.transition(JobStatus.FAILED, StopReason.ITEM_FAILED, null, clock.instant());
        checkpoints.save(failed);
        trigger.cancelPending(failed.jobId());
        log.warn("Job {} failed at offset {} after {} item(s) this run", failed.jobId(), failed.nextOffset(), done);
        return RunResult.failed(failed, StopReason.ITEM_FAILED, done);
    }

    private RunResult cancelled(Checkpoint cp, long done) {
        Checkpoint cancelled = cp.transition(JobStatus.CANCELLED, StopReason.CANCELLED, null, clock.instant());
        checkpoints.save(cancelled);
        trigger.cancelPending(cancelled.jobId());
        registry.unregister(cancelled.jobId());
        log.info("Job {} cancelled at offset {}", cancelled.jobId(), cancelled.lastCompletedOffset());
        return RunResult.failed(cancelled, StopReason.CANCELLED, done);
    }

    private RunResult complete(Checkpoint cp, JobOptions opts, long done) {
        Checkpoint completed = cp.transition(JobStatus.COMPLETED, StopReason.NONE, null, clock.instant());
        checkpoints.save(completed);
        // the archived record keeps later invocations from starting over; only restart() clears it
        checkpoints.archive(opts.archiveOnComplete() ? completed : completed.withoutCounters());
        trigger.cancelPending(completed.jobId());
        registry.unregister(completed.jobId());
        log.info("Job {} completed: processed={} failed={}", completed.jobId(),
                completed.counter(Checkpoint.PROCESSED), completed.counter(Checkpoint.FAILED));
        return RunResult.completed(completed, done);
    }

    private RunResult terminalResult(Checkpoint cp) {
        return switch (cp.status()) {
            case COMPLETED -> RunResult.completed(cp, 0);
            case CANCELLED -> RunResult.failed(cp, StopReason.CANCELLED, 0);
            default -> RunResult.failed(cp, cp.stopReason(), 0);
        };
    }

    private void arm(String jobId, Duration delay) {
        try {
            trigger.schedule(delay, jobId);
        } catch (RuntimeException e) {
            // the PAUSED checkpoint is already durable; an external sweep can still pick the job up
            log.error("Could not arm resumption for job {}", jobId, e);
        }
    }

    private static String lockName(String jobId) {
        return "job:" + jobId;
    }
}

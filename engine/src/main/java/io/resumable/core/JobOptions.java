package io.resumable.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-job knobs. {@code quotaBudget} and {@code dependency} may be null when the job does not draw on a
 * budget or should not be guarded by a circuit breaker.
 */
public record JobOptions(
        String quotaBudget,
        long itemCost,
        String dependency,
        FailurePolicy failurePolicy,
        int checkpointEvery,
        Duration timeBudget,
        double safetyMarginRatio,
        Duration resumeDelay,
        boolean archiveOnComplete
) {
    public JobOptions {
        Objects.requireNonNull(failurePolicy, "failurePolicy");
        Objects.requireNonNull(timeBudget, "timeBudget");
        Objects.requireNonNull(resumeDelay, "resumeDelay");
        if (itemCost < 0) throw new IllegalArgumentException("itemCost must be >= 0");
        if (checkpointEvery < 1) throw new IllegalArgumentException("checkpointEvery must be >= 1");
        if (timeBudget.isNegative() || timeBudget.isZero()) throw new IllegalArgumentException("timeBudget must be positive");
        if (safetyMarginRatio < 0 || safetyMarginRatio >= 1) throw new IllegalArgumentException("safetyMarginRatio must be in [0, 1)");
    }

    public static JobOptions defaults() {
        return new JobOptions(null, 1, null, FailurePolicy.SKIP_AND_CONTINUE, 10,
                Duration.ofMinutes(6), 0.2, Duration.ofMinutes(1), false);
    }

    /** Portion of the time budget reserved for a clean checkpoint-and-return. */
    public Duration safetyMargin() {
        return Duration.ofNanos((long) (timeBudget.toNanos() * safetyMarginRatio));
    }

    /** Elapsed time after which no further item is started. */
    public Duration workingBudget() {
        return timeBudget.minus(safetyMargin());
    }

    public JobOptions withQuota(String budget, long cost) {
        return new JobOptions(budget, cost, dependency, failurePolicy, checkpointEvery, timeBudget, safetyMarginRatio, resumeDelay, archiveOnComplete);
    }

    public JobOptions withDependency(String dep) {
        return new JobOptions(quotaBudget, itemCost, dep, failurePolicy, checkpointEvery, timeBudget, safetyMarginRatio, resumeDelay, archiveOnComplete);
    }

    public JobOptions withFailurePolicy(FailurePolicy policy) {
        return new JobOptions(quotaBudget, itemCost, dependency, policy, checkpointEvery, timeBudget, safetyMarginRatio, resumeDelay, archiveOnComplete);
    }

    public JobOptions withCheckpointEvery(int every) {
        return new JobOptions(quotaBudget, itemCost, dependency, failurePolicy, every, timeBudget, safetyMarginRatio, resumeDelay, archiveOnComplete);
    }

    public JobOptions withTimeBudget(Duration budget, double marginRatio) {
        return new JobOptions(quotaBudget, itemCost, dependency, failurePolicy, checkpointEvery, budget, marginRatio, resumeDelay, archiveOnComplete);
    }

    public JobOptions withResumeDelay(Duration delay) {
        return new JobOptions(quotaBudget, itemCost, dependency, failurePolicy, checkpointEvery, timeBudget, safetyMarginRatio, delay, archiveOnComplete);
    }

    public JobOptions withArchiveOnComplete(boolean archive) {
        return new JobOptions(quotaBudget, itemCost, dependency, failurePolicy, checkpointEvery, timeBudget, safetyMarginRatio, resumeDelay, archive);
    }
}

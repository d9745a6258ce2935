package io.resumable.core;

import io.resumable.checkpoint.Checkpoint;

import java.time.Duration;

/**
 * Tagged result of one scheduler invocation. {@code resumeAfter} is set when a resumption was armed;
 * {@code checkpoint} is the last persisted state (null when the run was skipped before loading it).
 */
public record RunResult(
        String jobId,
        RunStatus status,
        StopReason reason,
        Duration resumeAfter,
        long itemsThisRun,
        Checkpoint checkpoint
) {
    public static RunResult completed(Checkpoint cp, long items) {
        return new RunResult(cp.jobId(), RunStatus.COMPLETED, StopReason.NONE, null, items, cp);
    }

    public static RunResult paused(Checkpoint cp, StopReason reason, Duration resumeAfter, long items) {
        return new RunResult(cp.jobId(), RunStatus.PAUSED, reason, resumeAfter, items, cp);
    }

    public static RunResult failed(Checkpoint cp, StopReason reason, long items) {
        return new RunResult(cp.jobId(), RunStatus.FAILED, reason, null, items, cp);
    }

    public static RunResult skipped(String jobId, StopReason reason, Checkpoint cp) {
        return new RunResult(jobId, RunStatus.SKIPPED, reason, null, 0, cp);
    }

    public long counter(String name) {
        return checkpoint == null ? 0 : checkpoint.counter(name);
    }
}

package io.resumable.checkpoint;

import io.resumable.core.JobStatus;
import io.resumable.core.StopReason;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Persisted progress of one job. Kept deliberately small: offsets and counters, never item payloads.
 */
public record Checkpoint(
        int schemaVersion,
        String jobId,
        long lastCompletedOffset,
        JobStatus status,
        StopReason stopReason,
        Map<String, Long> counters,
        Instant resumeAt,
        Instant updatedAt
) {
    public static final int CURRENT_VERSION = 1;

    public static final String PROCESSED = "processed";
    public static final String FAILED = "failed";
    public static final String SKIPPED = "skipped";
    public static final String RETRIES = "retries";
    public static final String RUNS = "runs";

    public Checkpoint {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(status, "status");
        if (stopReason == null) stopReason = StopReason.NONE;
        if (lastCompletedOffset < -1) throw new IllegalArgumentException("lastCompletedOffset must be >= -1");
        // key order keeps stored records stable between saves
        counters = Collections.unmodifiableMap(counters == null ? new TreeMap<>() : new TreeMap<>(counters));
    }

    public static Checkpoint initial(String jobId, Instant now) {
        return new Checkpoint(CURRENT_VERSION, jobId, -1, JobStatus.NEW, StopReason.NONE, Map.of(), null, now);
    }

    /** Next offset to process. */
    public long nextOffset() {
        return lastCompletedOffset + 1;
    }

    public long counter(String name) {
        return counters.getOrDefault(name, 0L);
    }

    public Checkpoint advanceTo(long offset, Instant now) {
        if (offset < lastCompletedOffset) {
            throw new IllegalArgumentException("offset " + offset + " is behind " + lastCompletedOffset + " for job " + jobId);
        }
        return new Checkpoint(schemaVersion, jobId, offset, status, stopReason, counters, resumeAt, now);
    }

    public Checkpoint increment(String name, long delta) {
        if (delta == 0) return this;
        Map<String, Long> next = new TreeMap<>(counters);
        next.merge(name, delta, Long::sum);
        return new Checkpoint(schemaVersion, jobId, lastCompletedOffset, status, stopReason, next, resumeAt, updatedAt);
    }

    /** Same position and status with the counters dropped; marks a finished job at minimal size. */
    public Checkpoint withoutCounters() {
        return new Checkpoint(schemaVersion, jobId, lastCompletedOffset, status, stopReason, Map.of(), null, updatedAt);
    }

    public Checkpoint transition(JobStatus newStatus, StopReason reason, Instant resume, Instant now) {
        return new Checkpoint(schemaVersion, jobId, lastCompletedOffset, newStatus, reason, counters, resume, now);
    }
}

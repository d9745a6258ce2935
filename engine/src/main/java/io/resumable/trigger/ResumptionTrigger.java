package io.resumable.trigger;

import java.time.Duration;

/**
 * Arranges a future, best-effort invocation of a paused job. Timing may drift; what matters is that it
 * happens eventually and at most once per arming.
 */
public interface ResumptionTrigger {
    /** Arms a resumption after {@code delay}, replacing any resumption already pending for the job. */
    void schedule(Duration delay, String jobId);

    void cancelPending(String jobId);

    boolean isPending(String jobId);
}

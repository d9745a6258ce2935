package io.resumable.quota;

import io.resumable.core.BatchEngineException;

import java.time.Instant;

/**
 * A budget cannot cover a spend. Never retried inline: the job pauses until {@link #resetAt()}.
 */
public class QuotaExceededException extends BatchEngineException {
    private final String budget;
    private final Instant resetAt;

    public QuotaExceededException(String budget, long requested, long remaining, Instant resetAt) {
        super("quota '" + budget + "' cannot cover " + requested + " (remaining " + remaining + ", resets at " + resetAt + ")");
        this.budget = budget;
        this.resetAt = resetAt;
    }

    /** For work functions that learn about an exhausted quota from the remote side. */
    public QuotaExceededException(String budget, Instant resetAt, String message) {
        super(message);
        this.budget = budget;
        this.resetAt = resetAt;
    }

    public String budget() { return budget; }

    /** When the budget is expected to be usable again; may be null if unknown. */
    public Instant resetAt() { return resetAt; }
}

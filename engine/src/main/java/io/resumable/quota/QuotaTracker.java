package io.resumable.quota;

import java.time.Instant;

/**
 * Check-then-spend accounting for named budgets shared by every job. Callers ask {@link #canSpend} first;
 * {@link #spend} never clamps and throws when the budget cannot cover the amount.
 */
public interface QuotaTracker {
    boolean canSpend(String budget, long amount);

    /**
     * @throws QuotaExceededException when {@code canSpend(budget, amount)} is false
     */
    void spend(String budget, long amount);

    long remaining(String budget);

    /** Instant the current window of {@code budget} ends. */
    Instant nextReset(String budget);

    /** Explicit reset, for callers that learn about the real resource's reset out of band. */
    void reset(String budget);
}

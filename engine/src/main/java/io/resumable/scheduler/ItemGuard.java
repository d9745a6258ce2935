package io.resumable.scheduler;

import io.resumable.circuit.CircuitBreaker;
import io.resumable.core.JobOptions;
import io.resumable.core.StopReason;
import io.resumable.quota.QuotaExceededException;
import io.resumable.quota.QuotaTracker;
import io.resumable.retry.AttemptGuard;
import io.resumable.retry.ErrorClass;

import java.time.Clock;
import java.time.Instant;

/**
 * Admission for every attempt of one item: time budget (retries only), quota, then circuit. Quota is
 * charged once the breaker lets the call through, because the call costs quota whatever it returns.
 */
final class ItemGuard implements AttemptGuard {
    private final JobOptions options;
    private final QuotaTracker quota;
    private final CircuitBreaker breaker;
    private final Clock clock;
    private final Instant runStarted;

    ItemGuard(JobOptions options, QuotaTracker quota, CircuitBreaker breaker, Clock clock, Instant runStarted) {
        this.options = options;
        this.quota = quota;
        this.breaker = breaker;
        this.clock = clock;
        this.runStarted = runStarted;
    }

    @Override
    public StopReason beforeAttempt(int attempt) {
        // the first attempt was already cleared by the loop's own time check
        if (attempt > 1 && BatchScheduler.budgetExhausted(runStarted, clock.instant(), options)) {
            return StopReason.TIME_BUDGET;
        }
        String budget = options.quotaBudget();
        if (budget != null && !quota.canSpend(budget, options.itemCost())) {
            return StopReason.QUOTA_EXCEEDED;
        }
        String dep = options.dependency();
        if (dep != null && !breaker.allow(dep)) {
            return StopReason.CIRCUIT_OPEN;
        }
        if (budget != null) {
            try {
                quota.spend(budget, options.itemCost());
            } catch (QuotaExceededException e) {
                // another job drained the budget since canSpend
                return StopReason.QUOTA_EXCEEDED;
            }
        }
        return StopReason.NONE;
    }

    @Override
    public void afterAttempt(int attempt, Throwable error, ErrorClass errorClass) {
        String dep = options.dependency();
        if (dep == null) return;
        if (error != null && errorClass == ErrorClass.RETRYABLE) {
            breaker.recordFailure(dep);
        } else {
            // success, or a fatal answer: either way the dependency responded
            breaker.recordSuccess(dep);
        }
    }
}

package io.resumable.retry;

import io.resumable.core.StopReason;
import io.resumable.quota.QuotaExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Runs a call with bounded retries. Never throws for work errors: the caller branches on the returned
 * {@link AttemptOutcome}. Quota and circuit checks are the guard's business, not the executor's.
 */
public class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = sleeper == null ? Sleeper.system() : sleeper;
    }

    public RetryPolicy policy() {
        return policy;
    }

    public <T> AttemptOutcome<T> execute(Callable<T> call, ErrorClassifier classifier, AttemptGuard guard) {
        Objects.requireNonNull(call, "call");
        ErrorClassifier cls = classifier == null ? DefaultErrorClassifier.INSTANCE : classifier;
        AttemptGuard g = guard == null ? AttemptGuard.NONE : guard;
        Throwable lastError = null;
        int attempt = 0;
        while (true) {
            StopReason block = g.beforeAttempt(attempt + 1);
            if (block != StopReason.NONE) {
                return AttemptOutcome.blocked(block, lastError, attempt);
            }
            attempt++;
            try {
                T value = call.call();
                g.afterAttempt(attempt, null, null);
                return AttemptOutcome.succeeded(value, attempt);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                g.afterAttempt(attempt, ie, ErrorClass.FATAL);
                return AttemptOutcome.failed(ie, ErrorClass.FATAL, attempt);
            } catch (QuotaExceededException qe) {
                // the remote side says the quota is gone; this is a job-level pause, never a retry
                g.afterAttempt(attempt, qe, ErrorClass.FATAL);
                return AttemptOutcome.blocked(StopReason.QUOTA_EXCEEDED, qe, attempt);
            } catch (Exception e) {
                lastError = e;
                ErrorClass errorClass = cls.classify(e);
                g.afterAttempt(attempt, e, errorClass);
                if (errorClass == ErrorClass.FATAL || !policy.shouldRetry(attempt, e)) {
                    return AttemptOutcome.failed(e, errorClass, attempt);
                }
                long backoff = policy.backoffMillis(attempt);
                log.debug("Attempt {} failed ({}); retrying in {} ms", attempt, e.toString(), backoff);
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return AttemptOutcome.failed(e, errorClass, attempt);
                }
            }
        }
    }
}

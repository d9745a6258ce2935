package io.resumable.scheduler;

import com.codahale.metrics.MetricRegistry;
import io.resumable.checkpoint.CheckpointStore;
import io.resumable.circuit.CircuitBreaker;
import io.resumable.error.DeadLetterSink;
import io.resumable.error.LoggingDeadLetterSink;
import io.resumable.lock.InMemoryLockManager;
import io.resumable.lock.LockManager;
import io.resumable.metrics.Metrics;
import io.resumable.quota.QuotaTracker;
import io.resumable.retry.DefaultErrorClassifier;
import io.resumable.retry.ErrorClassifier;
import io.resumable.retry.ExponentialBackoffRetryPolicy;
import io.resumable.retry.RetryExecutor;
import io.resumable.retry.RetryPolicy;
import io.resumable.retry.Sleeper;
import io.resumable.trigger.ResumptionTrigger;
import io.resumable.trigger.ScheduledResumptionTrigger;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public class BatchSchedulerBuilder {
    private CheckpointStore checkpoints;
    private QuotaTracker quota;
    private CircuitBreaker breaker;
    private RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy(3, 500, 30_000);
    private Sleeper sleeper = Sleeper.system();
    private ErrorClassifier classifier = DefaultErrorClassifier.INSTANCE;
    private LockManager locks = new InMemoryLockManager();
    private Duration lockWait = Duration.ofSeconds(10);
    private ResumptionTrigger trigger;
    private JobRegistry registry = new JobRegistry();
    private DeadLetterSink deadLetters = new LoggingDeadLetterSink();
    private MetricRegistry metricRegistry = new MetricRegistry();
    private Clock clock = Clock.systemUTC();

    public BatchSchedulerBuilder checkpoints(CheckpointStore s) { this.checkpoints = s; return this; }
    public BatchSchedulerBuilder quota(QuotaTracker q) { this.quota = q; return this; }
    public BatchSchedulerBuilder circuitBreaker(CircuitBreaker b) { this.breaker = b; return this; }
    public BatchSchedulerBuilder retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public BatchSchedulerBuilder sleeper(Sleeper s) { this.sleeper = s; return this; }
    public BatchSchedulerBuilder classifier(ErrorClassifier c) { this.classifier = c; return this; }
    public BatchSchedulerBuilder locks(LockManager l) { this.locks = l; return this; }
    public BatchSchedulerBuilder lockWait(Duration d) { this.lockWait = d; return this; }
    public BatchSchedulerBuilder trigger(ResumptionTrigger t) { this.trigger = t; return this; }
    public BatchSchedulerBuilder registry(JobRegistry r) { this.registry = r; return this; }
    public BatchSchedulerBuilder deadLetters(DeadLetterSink d) { this.deadLetters = d; return this; }
    public BatchSchedulerBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public BatchSchedulerBuilder clock(Clock c) { this.clock = c; return this; }

    public BatchScheduler build() {
        Objects.requireNonNull(checkpoints, "checkpoints");
        Objects.requireNonNull(quota, "quota");
        Objects.requireNonNull(breaker, "circuitBreaker");
        Objects.requireNonNull(retryPolicy, "retry");
        Objects.requireNonNull(trigger, "trigger");
        BatchScheduler scheduler = new BatchScheduler(checkpoints, quota, breaker, new RetryExecutor(retryPolicy, sleeper),
                classifier, locks, lockWait, trigger, registry, deadLetters, new Metrics(metricRegistry), clock);
        if (trigger instanceof ScheduledResumptionTrigger st && !st.hasLauncher()) {
            st.launchWith(scheduler::resume);
        }
        return scheduler;
    }
}

package io.resumable.inject;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.resumable.checkpoint.CheckpointCodec;
import io.resumable.checkpoint.CheckpointStore;
import io.resumable.checkpoint.KeyValueCheckpointStore;
import io.resumable.circuit.CircuitBreaker;
import io.resumable.circuit.DefaultCircuitBreaker;
import io.resumable.config.EngineConfig;
import io.resumable.error.DeadLetterSink;
import io.resumable.error.FileDeadLetterSink;
import io.resumable.error.LoggingDeadLetterSink;
import io.resumable.quota.SimpleQuotaTracker;
import io.resumable.retry.ExponentialBackoffRetryPolicy;
import io.resumable.scheduler.BatchScheduler;
import io.resumable.store.FileKeyValueStore;
import io.resumable.store.InMemoryKeyValueStore;
import io.resumable.store.JdbcKeyValueStore;
import io.resumable.store.KeyValueStore;
import io.resumable.trigger.ScheduledResumptionTrigger;

import java.io.IOException;
import java.time.Clock;

public class EngineModule extends AbstractModule {
    private final EngineConfig config;

    public EngineModule(EngineConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(EngineConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Clock clock() { return Clock.systemUTC(); }

    @Provides @Singleton KeyValueStore keyValueStore() throws IOException {
        return switch (config.store()) {
            case EngineConfig.STORE_MEMORY -> new InMemoryKeyValueStore(config.maxCheckpointBytes());
            case EngineConfig.STORE_JDBC -> new JdbcKeyValueStore(config.jdbcUrl(), "sa", "", "checkpoints", config.maxCheckpointBytes()).initSchema();
            default -> new FileKeyValueStore(config.stateDir(), config.maxCheckpointBytes());
        };
    }

    @Provides @Singleton CheckpointStore checkpointStore(KeyValueStore store) {
        return new KeyValueCheckpointStore(store, new CheckpointCodec(config.maxCheckpointBytes()));
    }

    @Provides @Singleton SimpleQuotaTracker quotaTracker(Clock clock, KeyValueStore store) { return new SimpleQuotaTracker(clock, store); }

    @Provides @Singleton CircuitBreaker circuitBreaker(Clock clock) {
        return new DefaultCircuitBreaker(config.breakerFailureThreshold(), config.breakerSuccessThreshold(), config.breakerCooldown(), clock);
    }

    @Provides @Singleton DeadLetterSink deadLetters() throws IOException {
        if (EngineConfig.STORE_MEMORY.equals(config.store())) return new LoggingDeadLetterSink();
        return new FileDeadLetterSink(config.stateDir().resolve("dead-letters.jsonl"));
    }

    @Provides @Singleton ScheduledResumptionTrigger trigger() { return new ScheduledResumptionTrigger(); }

    @Provides @Singleton BatchScheduler scheduler(CheckpointStore checkpoints, SimpleQuotaTracker quota, CircuitBreaker breaker,
                                                  ScheduledResumptionTrigger trigger, DeadLetterSink deadLetters,
                                                  MetricRegistry registry, Clock clock) {
        return BatchScheduler.builder()
                .checkpoints(checkpoints)
                .quota(quota)
                .circuitBreaker(breaker)
                .retry(new ExponentialBackoffRetryPolicy(config.maxRetries(), config.backoffBaseMillis(), config.backoffMaxMillis()))
                .lockWait(config.lockWait())
                .trigger(trigger)
                .deadLetters(deadLetters)
                .metrics(registry)
                .clock(clock)
                .build();
    }
}

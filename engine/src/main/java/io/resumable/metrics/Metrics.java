package io.resumable.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import io.resumable.core.StopReason;

import java.util.Locale;

/**
 * Engine metric names over a Dropwizard registry.
 */
public class Metrics {
    public static final String ITEMS_PROCESSED = "scheduler.items.processed";
    public static final String ITEMS_FAILED = "scheduler.items.failed";
    public static final String ITEMS_SKIPPED = "scheduler.items.skipped";
    public static final String RETRIES = "scheduler.retries";
    public static final String ITEM_TIME = "scheduler.item.time";
    public static final String RUN_TIME = "scheduler.run.time";
    public static final String RUNS_SKIPPED = "scheduler.runs.skipped";
    public static final String PAUSES_PREFIX = "scheduler.pauses.";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Meter meter(String name) { return registry.meter(name); }
    public Timer timer(String name) { return registry.timer(name); }

    public Counter pauses(StopReason reason) {
        return registry.counter(pauseName(reason));
    }

    public static String pauseName(StopReason reason) {
        return PAUSES_PREFIX + reason.name().toLowerCase(Locale.ROOT);
    }
}

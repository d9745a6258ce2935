package io.resumable.quota;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.resumable.checkpoint.CheckpointCodec;
import io.resumable.checkpoint.CheckpointStoreException;
import io.resumable.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process tracker with lazy window rolling. When given a {@link KeyValueStore} it mirrors each budget's
 * window start and consumption under {@code quota:<name>} so usage survives restarts.
 */
public class SimpleQuotaTracker implements QuotaTracker {
    private static final Logger log = LoggerFactory.getLogger(SimpleQuotaTracker.class);
    private static final String KEY_PREFIX = "quota:";

    private final Map<String, QuotaBudget> budgets = new ConcurrentHashMap<>();
    private final Clock clock;
    private final KeyValueStore store;
    private final ObjectMapper mapper = CheckpointCodec.defaultMapper();

    public SimpleQuotaTracker(Clock clock) {
        this(clock, null);
    }

    public SimpleQuotaTracker(Clock clock, KeyValueStore store) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.store = store;
    }

    /** Registers a budget whose first window opens now, restoring persisted usage when present. */
    public synchronized QuotaBudget register(String name, long limit, WindowBoundary boundary) {
        QuotaBudget budget = new QuotaBudget(name, limit, boundary, clock.instant());
        if (store != null) {
            Snapshot snap = readSnapshot(name);
            if (snap != null) {
                budget.restore(snap.windowStart(), snap.consumed());
                log.info("Restored quota {} consumed={} since {}", name, budget.consumed(), budget.windowStart());
            }
        }
        budgets.put(name, budget);
        return budget;
    }

    @Override
    public synchronized boolean canSpend(String budget, long amount) {
        QuotaBudget b = current(budget);
        return amount <= b.remaining();
    }

    @Override
    public synchronized void spend(String budget, long amount) {
        if (amount < 0) throw new IllegalArgumentException("amount must be >= 0");
        QuotaBudget b = current(budget);
        if (amount > b.remaining()) {
            throw new QuotaExceededException(budget, amount, b.remaining(), b.windowEnd());
        }
        b.add(amount);
        persist(b);
    }

    @Override
    public synchronized long remaining(String budget) {
        return current(budget).remaining();
    }

    @Override
    public synchronized Instant nextReset(String budget) {
        return current(budget).windowEnd();
    }

    @Override
    public synchronized void reset(String budget) {
        QuotaBudget b = lookup(budget);
        b.reset(clock.instant());
        persist(b);
        log.info("Quota {} reset explicitly", budget);
    }

    public synchronized QuotaBudget budget(String name) {
        return current(name);
    }

    private QuotaBudget current(String name) {
        QuotaBudget b = lookup(name);
        if (b.rollIfDue(clock.instant())) {
            log.debug("Quota {} window rolled; next reset {}", name, b.windowEnd());
            persist(b);
        }
        return b;
    }

    private QuotaBudget lookup(String name) {
        QuotaBudget b = budgets.get(name);
        if (b == null) throw new IllegalArgumentException("unknown quota budget '" + name + "'");
        return b;
    }

    private void persist(QuotaBudget b) {
        if (store == null) return;
        try {
            store.set(KEY_PREFIX + b.name(), mapper.writeValueAsBytes(new Snapshot(b.windowStart(), b.consumed())));
        } catch (JsonProcessingException e) {
            throw new CheckpointStoreException("cannot encode quota " + b.name(), e);
        }
    }

    private Snapshot readSnapshot(String name) {
        byte[] bytes = store.get(KEY_PREFIX + name);
        if (bytes == null) return null;
        try {
            return mapper.readValue(bytes, Snapshot.class);
        } catch (IOException e) {
            log.warn("Ignoring unreadable quota snapshot for {}", name, e);
            return null;
        }
    }

    record Snapshot(Instant windowStart, long consumed) {}
}

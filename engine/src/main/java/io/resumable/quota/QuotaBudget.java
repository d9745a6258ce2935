package io.resumable.quota;

import java.time.Instant;
import java.util.Objects;

/**
 * A named spend counter over a window. Mutated only through a {@link QuotaTracker}, which serialises access.
 */
public final class QuotaBudget {
    private final String name;
    private final long limit;
    private final WindowBoundary boundary;

    private Instant windowStart;
    private long consumed;

    public QuotaBudget(String name, long limit, WindowBoundary boundary, Instant windowStart) {
        this.name = Objects.requireNonNull(name, "name");
        this.boundary = Objects.requireNonNull(boundary, "boundary");
        this.windowStart = Objects.requireNonNull(windowStart, "windowStart");
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        this.limit = limit;
    }

    public String name() { return name; }
    public long limit() { return limit; }
    public Instant windowStart() { return windowStart; }
    public long consumed() { return consumed; }

    public Instant windowEnd() {
        return boundary.windowEnd(windowStart);
    }

    /** Opens a fresh window if {@code now} has crossed the current one's end. Returns true if it did. */
    boolean rollIfDue(Instant now) {
        if (now.isBefore(windowEnd())) return false;
        windowStart = now;
        consumed = 0;
        return true;
    }

    void reset(Instant now) {
        windowStart = now;
        consumed = 0;
    }

    void restore(Instant start, long used) {
        this.windowStart = start;
        this.consumed = Math.min(Math.max(0, used), limit);
    }

    long remaining() {
        return limit - consumed;
    }

    void add(long amount) {
        consumed += amount;
    }

    @Override
    public String toString() {
        return "QuotaBudget{" + name + " " + consumed + "/" + limit + " since " + windowStart + "}";
    }
}

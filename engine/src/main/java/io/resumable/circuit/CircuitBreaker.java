package io.resumable.circuit;

import java.time.Duration;

/**
 * Per-dependency fault isolation.
 *
 * <p>CLOSED → OPEN once consecutive failures reach the failure threshold. OPEN rejects every call until the
 * cooldown has elapsed, then the next {@link #allow} moves to HALF_OPEN and admits exactly one trial call.
 * Each successful trial admits the next one; enough of them close the circuit, any failure reopens it.</p>
 *
 * <p>A rejected {@link #allow} is a fast-reject: callers must not count it as a failure of the work.</p>
 */
public interface CircuitBreaker {
    boolean allow(String dependency);

    void recordSuccess(String dependency);

    void recordFailure(String dependency);

    CircuitState state(String dependency);

    /** How long until {@link #allow} may return true again; zero when it already would. */
    Duration retryAfter(String dependency);

    CircuitSnapshot snapshot(String dependency);

    /** Forces the circuit back to CLOSED. */
    void reset(String dependency);
}

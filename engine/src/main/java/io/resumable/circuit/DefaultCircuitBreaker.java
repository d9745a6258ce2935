package io.resumable.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class DefaultCircuitBreaker implements CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(DefaultCircuitBreaker.class);

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 3;

    private final int failureThreshold;
    private final int successThreshold;
    private final Duration cooldown;
    private final Clock clock;
    private final Map<String, Circuit> circuits = new ConcurrentHashMap<>();

    public DefaultCircuitBreaker(Duration cooldown, Clock clock) {
        this(DEFAULT_FAILURE_THRESHOLD, DEFAULT_SUCCESS_THRESHOLD, cooldown, clock);
    }

    public DefaultCircuitBreaker(int failureThreshold, int successThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) throw new IllegalArgumentException("failureThreshold must be >= 1");
        if (successThreshold < 1) throw new IllegalArgumentException("successThreshold must be >= 1");
        if (cooldown == null || cooldown.isNegative()) throw new IllegalArgumentException("cooldown must be >= 0");
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.cooldown = cooldown;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public boolean allow(String dependency) {
        Circuit c = circuit(dependency);
        synchronized (c) {
            switch (c.state) {
                case CLOSED -> {
                    return true;
                }
                case OPEN -> {
                    if (clock.instant().isBefore(c.openedAt.plus(cooldown))) return false;
                    c.state = CircuitState.HALF_OPEN;
                    c.halfOpenSuccesses = 0;
                    startTrial(c);
                    log.info("Circuit {} half-open after {} cooldown", dependency, cooldown);
                    return true;
                }
                default -> {
                    // a trial whose caller never reported back (crashed host) expires after one cooldown
                    if (c.trialInFlight && clock.instant().isBefore(c.trialStartedAt.plus(cooldown))) return false;
                    startTrial(c);
                    return true;
                }
            }
        }
    }

    @Override
    public void recordSuccess(String dependency) {
        Circuit c = circuit(dependency);
        synchronized (c) {
            c.consecutiveFailures = 0;
            if (c.state == CircuitState.HALF_OPEN) {
                c.trialInFlight = false;
                c.halfOpenSuccesses++;
                if (c.halfOpenSuccesses >= successThreshold) {
                    c.state = CircuitState.CLOSED;
                    c.halfOpenSuccesses = 0;
                    log.info("Circuit {} closed after {} successful trials", dependency, successThreshold);
                }
            }
        }
    }

    @Override
    public void recordFailure(String dependency) {
        Circuit c = circuit(dependency);
        synchronized (c) {
            c.consecutiveFailures++;
            if (c.state == CircuitState.HALF_OPEN) {
                open(dependency, c, "trial call failed");
            } else if (c.state == CircuitState.CLOSED && c.consecutiveFailures >= failureThreshold) {
                open(dependency, c, c.consecutiveFailures + " consecutive failures");
            }
        }
    }

    @Override
    public CircuitState state(String dependency) {
        Circuit c = circuit(dependency);
        synchronized (c) {
            return c.state;
        }
    }

    @Override
    public Duration retryAfter(String dependency) {
        Circuit c = circuit(dependency);
        synchronized (c) {
            return switch (c.state) {
                case OPEN -> {
                    Duration left = Duration.between(clock.instant(), c.openedAt.plus(cooldown));
                    yield left.isNegative() ? Duration.ZERO : left;
                }
                // another caller holds the trial slot
                case HALF_OPEN -> {
                    if (!c.trialInFlight) yield Duration.ZERO;
                    Duration left = Duration.between(clock.instant(), c.trialStartedAt.plus(cooldown));
                    yield left.isNegative() ? Duration.ZERO : left;
                }
                case CLOSED -> Duration.ZERO;
            };
        }
    }

    @Override
    public CircuitSnapshot snapshot(String dependency) {
        Circuit c = circuit(dependency);
        synchronized (c) {
            return new CircuitSnapshot(dependency, c.state, c.consecutiveFailures, c.halfOpenSuccesses, c.openedAt);
        }
    }

    @Override
    public void reset(String dependency) {
        Circuit c = circuit(dependency);
        synchronized (c) {
            c.state = CircuitState.CLOSED;
            c.consecutiveFailures = 0;
            c.halfOpenSuccesses = 0;
            c.trialInFlight = false;
        }
    }

    private void open(String dependency, Circuit c, String why) {
        c.state = CircuitState.OPEN;
        c.openedAt = clock.instant();
        c.trialInFlight = false;
        c.halfOpenSuccesses = 0;
        log.warn("Circuit {} opened ({}); rejecting calls for {}", dependency, why, cooldown);
    }

    private void startTrial(Circuit c) {
        c.trialInFlight = true;
        c.trialStartedAt = clock.instant();
    }

    private Circuit circuit(String dependency) {
        return circuits.computeIfAbsent(dependency, d -> new Circuit());
    }

    private static final class Circuit {
        CircuitState state = CircuitState.CLOSED;
        int consecutiveFailures;
        int halfOpenSuccesses;
        boolean trialInFlight;
        Instant trialStartedAt;
        Instant openedAt;
    }
}

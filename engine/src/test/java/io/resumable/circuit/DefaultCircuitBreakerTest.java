package io.resumable.circuit;

import io.resumable.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultCircuitBreakerTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final DefaultCircuitBreaker breaker = new DefaultCircuitBreaker(5, 3, Duration.ofSeconds(30), clock);

    private void failTimes(int n) {
        for (int i = 0; i < n; i++) {
            assertTrue(breaker.allow("docs"));
            breaker.recordFailure("docs");
        }
    }

    @Test
    void opens_after_consecutive_failures_and_rejects() {
        failTimes(4);
        assertEquals(CircuitState.CLOSED, breaker.state("docs"));
        failTimes(1);
        assertEquals(CircuitState.OPEN, breaker.state("docs"));
        assertFalse(breaker.allow("docs"));
        assertEquals(Duration.ofSeconds(30), breaker.retryAfter("docs"));
    }

    @Test
    void success_resets_failure_count() {
        failTimes(4);
        breaker.recordSuccess("docs");
        failTimes(4);
        assertEquals(CircuitState.CLOSED, breaker.state("docs"));
        assertEquals(4, breaker.snapshot("docs").consecutiveFailures());
    }

    @Test
    void half_open_admits_one_trial_at_a_time() {
        failTimes(5);
        clock.advance(Duration.ofSeconds(30));
        assertTrue(breaker.allow("docs"));
        assertEquals(CircuitState.HALF_OPEN, breaker.state("docs"));
        assertFalse(breaker.allow("docs"), "second caller must wait for the trial");

        breaker.recordSuccess("docs");
        assertTrue(breaker.allow("docs"));
    }

    @Test
    void closes_after_enough_successful_trials() {
        failTimes(5);
        clock.advance(Duration.ofSeconds(31));
        for (int i = 0; i < 3; i++) {
            assertTrue(breaker.allow("docs"));
            breaker.recordSuccess("docs");
        }
        assertEquals(CircuitState.CLOSED, breaker.state("docs"));
    }

    @Test
    void failed_trial_reopens() {
        failTimes(5);
        clock.advance(Duration.ofSeconds(30));
        assertTrue(breaker.allow("docs"));
        breaker.recordFailure("docs");
        assertEquals(CircuitState.OPEN, breaker.state("docs"));
        assertFalse(breaker.allow("docs"));
    }

    @Test
    void abandoned_trial_slot_expires_after_cooldown() {
        failTimes(5);
        clock.advance(Duration.ofSeconds(30));
        assertTrue(breaker.allow("docs"));
        assertFalse(breaker.allow("docs"));
        assertEquals(Duration.ofSeconds(30), breaker.retryAfter("docs"));

        clock.advance(Duration.ofSeconds(30));
        assertTrue(breaker.allow("docs"));
    }

    @Test
    void dependencies_are_independent() {
        failTimes(5);
        assertTrue(breaker.allow("mail"));
        assertEquals(CircuitState.CLOSED, breaker.state("mail"));
        breaker.reset("docs");
        assertTrue(breaker.allow("docs"));
    }
}

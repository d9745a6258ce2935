package io.resumable.quota;

import io.resumable.MutableClock;
import io.resumable.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

public class SimpleQuotaTrackerTest {
    private static final WindowBoundary MIDNIGHT_NEW_YORK = WindowBoundary.dailyAt(LocalTime.MIDNIGHT, ZoneId.of("America/New_York"));

    @Test
    void spends_until_limit_then_refuses() {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-01T20:00:00Z"));
        SimpleQuotaTracker quota = new SimpleQuotaTracker(clock);
        quota.register("mail", 3, MIDNIGHT_NEW_YORK);

        assertTrue(quota.canSpend("mail", 2));
        quota.spend("mail", 2);
        assertEquals(1, quota.remaining("mail"));
        assertFalse(quota.canSpend("mail", 2));

        QuotaExceededException e = assertThrows(QuotaExceededException.class, () -> quota.spend("mail", 2));
        assertEquals("mail", e.budget());
        assertEquals(Instant.parse("2024-06-02T04:00:00Z"), e.resetAt());
        assertEquals(1, quota.remaining("mail"));
    }

    @Test
    void window_rolls_once_the_reset_instant_passes() {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-01T20:00:00Z"));
        SimpleQuotaTracker quota = new SimpleQuotaTracker(clock);
        quota.register("mail", 5, MIDNIGHT_NEW_YORK);
        quota.spend("mail", 5);
        assertEquals(Instant.parse("2024-06-02T04:00:00Z"), quota.nextReset("mail"));

        clock.set(Instant.parse("2024-06-02T03:59:59Z"));
        assertEquals(0, quota.remaining("mail"));

        clock.set(Instant.parse("2024-06-02T04:00:00Z"));
        assertEquals(5, quota.remaining("mail"));
        assertEquals(Instant.parse("2024-06-03T04:00:00Z"), quota.nextReset("mail"));
    }

    @Test
    void explicit_reset_clears_consumption() {
        SimpleQuotaTracker quota = new SimpleQuotaTracker(new MutableClock(Instant.parse("2024-06-01T20:00:00Z")));
        quota.register("api", 10, WindowBoundary.rolling(Duration.ofHours(1)));
        quota.spend("api", 7);
        quota.reset("api");
        assertEquals(10, quota.remaining("api"));
    }

    @Test
    void consumption_survives_a_new_tracker_over_the_same_store() {
        MutableClock clock = new MutableClock(Instant.parse("2024-06-01T20:00:00Z"));
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        SimpleQuotaTracker first = new SimpleQuotaTracker(clock, store);
        first.register("mail", 5, MIDNIGHT_NEW_YORK);
        first.spend("mail", 4);

        clock.advance(Duration.ofHours(1));
        SimpleQuotaTracker second = new SimpleQuotaTracker(clock, store);
        second.register("mail", 5, MIDNIGHT_NEW_YORK);
        assertEquals(1, second.remaining("mail"));
        assertEquals(Instant.parse("2024-06-01T20:00:00Z"), second.budget("mail").windowStart());
    }

    @Test
    void unknown_budget_is_a_programming_error() {
        SimpleQuotaTracker quota = new SimpleQuotaTracker(new MutableClock(Instant.EPOCH));
        assertThrows(IllegalArgumentException.class, () -> quota.canSpend("nope", 1));
    }
}

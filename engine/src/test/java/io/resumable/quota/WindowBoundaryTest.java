package io.resumable.quota;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

public class WindowBoundaryTest {
    private static final ZoneId PACIFIC = ZoneId.of("America/Los_Angeles");

    @Test
    void daily_reset_uses_the_provider_zone_not_utc() {
        WindowBoundary midnightPacific = WindowBoundary.dailyAt(LocalTime.MIDNIGHT, PACIFIC);
        // 2024-06-01 23:30 UTC is 16:30 PDT; next Pacific midnight is 07:00 UTC on the 2nd
        Instant end = midnightPacific.windowEnd(Instant.parse("2024-06-01T23:30:00Z"));
        assertEquals(Instant.parse("2024-06-02T07:00:00Z"), end);
    }

    @Test
    void daily_reset_exactly_at_boundary_moves_to_next_day() {
        WindowBoundary midnightPacific = WindowBoundary.dailyAt(LocalTime.MIDNIGHT, PACIFIC);
        Instant end = midnightPacific.windowEnd(Instant.parse("2024-06-02T07:00:00Z"));
        assertEquals(Instant.parse("2024-06-03T07:00:00Z"), end);
    }

    @Test
    void daily_reset_follows_daylight_saving_change() {
        WindowBoundary midnightPacific = WindowBoundary.dailyAt(LocalTime.MIDNIGHT, PACIFIC);
        // PST in early November after the switch back: midnight is 08:00 UTC
        Instant end = midnightPacific.windowEnd(Instant.parse("2024-11-03T12:00:00Z"));
        assertEquals(Instant.parse("2024-11-04T08:00:00Z"), end);
    }

    @Test
    void fixed_windows_align_to_epoch_multiples() {
        WindowBoundary hourly = WindowBoundary.fixed(Duration.ofHours(1));
        assertEquals(Instant.parse("2024-01-01T11:00:00Z"), hourly.windowEnd(Instant.parse("2024-01-01T10:15:00Z")));
    }

    @Test
    void rolling_windows_start_at_first_use() {
        WindowBoundary rolling = WindowBoundary.rolling(Duration.ofMinutes(10));
        assertEquals(Instant.parse("2024-01-01T10:25:00Z"), rolling.windowEnd(Instant.parse("2024-01-01T10:15:00Z")));
        assertThrows(IllegalArgumentException.class, () -> WindowBoundary.rolling(Duration.ZERO));
    }
}

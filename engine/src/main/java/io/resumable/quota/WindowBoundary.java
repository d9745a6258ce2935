package io.resumable.quota;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Computes when a quota window that opened at a given instant ends. Real quotas usually reset at a fixed
 * wall-clock time in the provider's zone, which a rolling window started on first use would miss.
 */
@FunctionalInterface
public interface WindowBoundary {
    /** First reset instant strictly after {@code windowStart}. */
    Instant windowEnd(Instant windowStart);

    /** Resets every day at {@code resetTime} in {@code zone}. */
    static WindowBoundary dailyAt(LocalTime resetTime, ZoneId zone) {
        Objects.requireNonNull(resetTime, "resetTime");
        Objects.requireNonNull(zone, "zone");
        return start -> {
            ZonedDateTime local = start.atZone(zone);
            ZonedDateTime candidate = local.toLocalDate().atTime(resetTime).atZone(zone);
            if (!candidate.isAfter(local)) {
                candidate = local.toLocalDate().plusDays(1).atTime(resetTime).atZone(zone);
            }
            return candidate.toInstant();
        };
    }

    /** Fixed-length windows aligned to multiples of {@code length} since the epoch. */
    static WindowBoundary fixed(Duration length) {
        long millis = positiveMillis(length);
        return start -> Instant.ofEpochMilli(Math.floorDiv(start.toEpochMilli(), millis) * millis + millis);
    }

    /** Windows of {@code length} measured from whenever the window opened. */
    static WindowBoundary rolling(Duration length) {
        positiveMillis(length);
        return start -> start.plus(length);
    }

    private static long positiveMillis(Duration length) {
        Objects.requireNonNull(length, "length");
        long millis = length.toMillis();
        if (millis <= 0) throw new IllegalArgumentException("window length must be positive");
        return millis;
    }
}

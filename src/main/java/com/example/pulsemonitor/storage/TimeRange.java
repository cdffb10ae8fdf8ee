package com.example.pulsemonitor.storage;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Inclusive time window for range queries.
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time range bounds are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time range end " + end + " is before start " + start);
        }
    }

    public static TimeRange lastOf(Duration window, Clock clock) {
        Instant now = clock.instant();
        return new TimeRange(now.minus(window), now);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }
}

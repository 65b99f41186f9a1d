package com.openwash.capacity.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed interval [start, end] on the UTC timeline.
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
    }

    public static TimeWindow of(Instant start, int durationMinutes) {
        return new TimeWindow(start, start.plus(Duration.ofMinutes(durationMinutes)));
    }

    public TimeWindow expandedBy(Duration buffer) {
        return new TimeWindow(start.minus(buffer), end.plus(buffer));
    }

    /**
     * Closed-interval test: windows that only touch at an endpoint still overlap.
     */
    public boolean overlaps(TimeWindow other) {
        return !start.isAfter(other.end) && !other.start.isAfter(end);
    }

    public long durationMinutes() {
        return Duration.between(start, end).toMinutes();
    }
}

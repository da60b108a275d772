package com.wastewrangler.shared.util;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Half-open time interval [start, end).
 */
public record TimeWindow(LocalDateTime start, LocalDateTime end) {

    public TimeWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("window bounds must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("window end " + end + " is before start " + start);
        }
    }

    public static TimeWindow of(LocalDateTime start, Duration length) {
        return new TimeWindow(start, start.plus(length));
    }

    /**
     * Widens the window by {@code padding} on both sides.
     */
    public TimeWindow buffered(Duration padding) {
        return new TimeWindow(start.minus(padding), end.plus(padding));
    }

    /**
     * Two windows overlap iff each starts before the other ends. Windows that
     * only touch at an endpoint do not overlap.
     */
    public boolean overlaps(TimeWindow other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }
}

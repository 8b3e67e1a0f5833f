package com.fairway.eventmodel;

import java.time.Instant;

/**
 * Half-open query window {@code [start, end)}.
 *
 * <p>An inverted range can be constructed so that callers can report it; query paths must check
 * {@link #isValid()} before touching any data.
 */
public record DateRange(Instant start, Instant end) {

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end must not be null");
        }
    }

    public static DateRange of(Instant start, Instant end) {
        return new DateRange(start, end);
    }

    /** {@code start <= end}. */
    public boolean isValid() {
        return !start.isAfter(end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public boolean isEmpty() {
        return !start.isBefore(end);
    }
}

package com.servicebooking.booking.domain.model;

import java.time.Instant;
import java.util.Comparator;

/**
 * Half-open instant interval [start, end).
 */
public record TimeRange(Instant start, Instant end) {

    public static final Comparator<TimeRange> BY_START =
            Comparator.comparing(TimeRange::start).thenComparing(TimeRange::end);

    public TimeRange {
        if (start == null || end == null || end.isBefore(start)) {
            throw new IllegalArgumentException("Invalid time range: " + start + " - " + end);
        }
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return start.isBefore(otherEnd) && end.isAfter(otherStart);
    }

    public boolean covers(Instant otherStart, Instant otherEnd) {
        return !start.isAfter(otherStart) && !end.isBefore(otherEnd);
    }
}

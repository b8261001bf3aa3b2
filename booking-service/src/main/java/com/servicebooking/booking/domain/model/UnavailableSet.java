package com.servicebooking.booking.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Sorted, pairwise-disjoint unavailable intervals for a range, plus whether the
 * external calendar contributed to it ({@code calendarDegraded} false) or not.
 */
public record UnavailableSet(List<TimeRange> intervals, boolean calendarDegraded) {

    public UnavailableSet {
        intervals = List.copyOf(intervals);
    }

    public boolean overlaps(Instant start, Instant end) {
        for (TimeRange interval : intervals) {
            if (!interval.start().isBefore(end)) {
                return false;
            }
            if (interval.overlaps(start, end)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when a single merged interval spans all of [start, end).
     * Intervals are merged when adjacent, so a day blocked by back-to-back entries is one interval.
     */
    public boolean covers(Instant start, Instant end) {
        return intervals.stream().anyMatch(interval -> interval.covers(start, end));
    }
}

package com.servicebooking.booking.domain.calendar;

import com.servicebooking.booking.domain.model.TimeRange;

import java.util.List;

/**
 * Busy intervals reported by an external calendar. {@code degraded} is true when the
 * calendar is not connected or could not be read in time; the list is then empty.
 */
public record BusyIntervals(List<TimeRange> intervals, boolean degraded) {

    public BusyIntervals {
        intervals = List.copyOf(intervals);
    }

    public static BusyIntervals of(List<TimeRange> intervals) {
        return new BusyIntervals(intervals, false);
    }

    public static BusyIntervals unavailable() {
        return new BusyIntervals(List.of(), true);
    }
}

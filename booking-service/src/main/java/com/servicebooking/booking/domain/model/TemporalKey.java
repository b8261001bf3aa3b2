package com.servicebooking.booking.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * The reserved unit of a booking: a calendar day for {@link BookingMode#DATE},
 * or a [start, end) instant pair for {@link BookingMode#TIMESLOT}.
 * {@link #slotKey()} is the value stored in the slot-exclusivity constraint.
 */
public record TemporalKey(BookingMode mode, LocalDate date, Instant start, Instant end) {

    public TemporalKey {
        Objects.requireNonNull(mode, "mode");
        if (mode == BookingMode.DATE) {
            Objects.requireNonNull(date, "date");
        } else {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
            if (!end.isAfter(start)) {
                throw new IllegalArgumentException("Slot end must be after start: " + start + " - " + end);
            }
        }
    }

    public static TemporalKey ofDate(LocalDate date) {
        return new TemporalKey(BookingMode.DATE, date, null, null);
    }

    public static TemporalKey ofSlot(Instant start, Instant end) {
        return new TemporalKey(BookingMode.TIMESLOT, null, start, end);
    }

    public String slotKey() {
        return mode == BookingMode.DATE ? date.toString() : start.toString();
    }

    @Override
    public String toString() {
        return mode == BookingMode.DATE ? date.toString() : start + "/" + end;
    }
}

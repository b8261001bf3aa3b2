package com.servicebooking.booking.domain.model;

/**
 * How an offering is reserved: a whole calendar day, or a start/end slot within a day.
 */
public enum BookingMode {
    DATE,
    TIMESLOT
}

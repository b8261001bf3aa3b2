package com.servicebooking.booking.exception;

import com.servicebooking.booking.domain.model.BookingStatus;
import com.servicebooking.common.exception.ConflictException;

/**
 * Operation not possible because the booking already reached a terminal status.
 */
public class BookingStateConflictException extends ConflictException {

    public BookingStateConflictException(Long bookingId, BookingStatus status) {
        super(String.format("Booking %d is already %s", bookingId, status), "BOOKING_CONFLICT");
    }
}

package com.servicebooking.booking.exception;

import com.servicebooking.booking.domain.model.BookingStatus;
import com.servicebooking.common.exception.BusinessException;
import lombok.Getter;

/**
 * The booking state machine has no edge from {@code from} to {@code to}.
 * Indicates an integration error (out-of-order or misrouted event), never a user error.
 */
@Getter
public class InvalidTransitionException extends BusinessException {

    private final Long bookingId;
    private final BookingStatus from;
    private final BookingStatus to;

    public InvalidTransitionException(Long bookingId, BookingStatus from, BookingStatus to) {
        super(String.format("Booking %d cannot move from %s to %s", bookingId, from, to), "INVALID_TRANSITION");
        this.bookingId = bookingId;
        this.from = from;
        this.to = to;
    }
}

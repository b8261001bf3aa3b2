package com.servicebooking.booking.exception;

import com.servicebooking.common.exception.ConflictException;

/**
 * The requested date or slot is held by another active booking, or is blacked out.
 * Callers should re-query availability and pick another slot rather than retry this one.
 */
public class SlotConflictException extends ConflictException {

    public SlotConflictException(String message) {
        super(message, "SLOT_CONFLICT");
    }

    public SlotConflictException(String message, Throwable cause) {
        super(message, cause, "SLOT_CONFLICT");
    }
}

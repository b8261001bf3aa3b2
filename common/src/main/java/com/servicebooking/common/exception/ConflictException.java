package com.servicebooking.common.exception;

/**
 * A write lost against concurrent or prior state (slot taken, stale version, already decided).
 * The caller should re-read and decide again; the engine never retries these itself.
 * Mapped to HTTP 409.
 */
public class ConflictException extends BusinessException {

    public ConflictException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ConflictException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}

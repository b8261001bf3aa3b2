package com.servicebooking.common.exception;

/**
 * Thrown when a required dependency (booking store, idempotency store, payment provider)
 * is temporarily unavailable. Nothing was committed; the client may retry with the same
 * idempotency key. Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

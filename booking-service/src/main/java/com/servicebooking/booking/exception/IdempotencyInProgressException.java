package com.servicebooking.booking.exception;

import com.servicebooking.common.exception.ConflictException;

/**
 * Another request with the same idempotency key is still running.
 */
public class IdempotencyInProgressException extends ConflictException {

    public IdempotencyInProgressException(String idempotencyKey) {
        super("A request with idempotency key " + idempotencyKey + " is still in progress. Retry shortly.",
                "IDEMPOTENCY_IN_PROGRESS");
    }
}

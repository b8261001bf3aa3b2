package com.servicebooking.booking.exception;

import lombok.Getter;

/**
 * A payment event could not be applied. The endpoint answers with an error status
 * so the provider keeps the event and redelivers it.
 */
@Getter
public class WebhookProcessingException extends RuntimeException {

    private final String eventId;

    public WebhookProcessingException(String eventId, Throwable cause) {
        super("Failed to process payment event " + eventId + ": " + cause.getMessage(), cause);
        this.eventId = eventId;
    }
}

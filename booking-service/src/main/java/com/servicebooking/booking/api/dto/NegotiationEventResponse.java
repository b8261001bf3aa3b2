package com.servicebooking.booking.api.dto;

import com.servicebooking.booking.domain.model.NegotiationEvent;

import java.time.LocalDateTime;

public record NegotiationEventResponse(
        Long id,
        NegotiationEvent.Type type,
        String actor,
        String payload,
        LocalDateTime createdAt
) {
    public static NegotiationEventResponse from(NegotiationEvent event) {
        return new NegotiationEventResponse(event.getId(), event.getType(), event.getActor(),
                event.getPayload(), event.getCreatedAt());
    }
}

package com.servicebooking.booking.api.dto;

import com.servicebooking.booking.domain.model.NegotiationRequest;
import com.servicebooking.booking.domain.model.RequestStatus;
import com.servicebooking.booking.domain.model.RequestType;

import java.time.LocalDateTime;

public record NegotiationRequestResponse(
        Long id,
        Long bookingId,
        RequestType type,
        String payload,
        String requestedBy,
        RequestStatus status,
        Integer version,
        String decidedBy,
        String decisionNote,
        LocalDateTime decidedAt,
        LocalDateTime expiresAt,
        LocalDateTime createdAt
) {
    public static NegotiationRequestResponse from(NegotiationRequest request) {
        return new NegotiationRequestResponse(
                request.getId(),
                request.getBookingId(),
                request.getType(),
                request.getPayload(),
                request.getRequestedBy(),
                request.getStatus(),
                request.getVersion(),
                request.getDecidedBy(),
                request.getDecisionNote(),
                request.getDecidedAt(),
                request.getExpiresAt(),
                request.getCreatedAt()
        );
    }
}

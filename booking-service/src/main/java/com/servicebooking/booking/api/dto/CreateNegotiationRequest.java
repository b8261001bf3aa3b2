package com.servicebooking.booking.api.dto;

import com.servicebooking.booking.domain.model.RequestType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateNegotiationRequest(
        @NotNull(message = "Booking ID cannot be null")
        Long bookingId,

        @NotNull(message = "Request type cannot be null")
        RequestType type,

        @Size(max = 10000)
        String payload,

        @Size(max = 100)
        String requestedBy
) {
}

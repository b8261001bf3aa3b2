package com.servicebooking.booking.api.dto;

import com.servicebooking.booking.domain.model.Booking;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CancelBookingRequest(
        @NotNull(message = "cancelledBy cannot be null")
        Booking.CancelledBy cancelledBy,

        @Size(max = 500)
        String reason
) {
}

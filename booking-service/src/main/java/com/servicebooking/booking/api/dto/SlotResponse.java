package com.servicebooking.booking.api.dto;

import java.time.Instant;

public record SlotResponse(
        Instant start,
        Instant end,
        boolean available
) {
}

package com.servicebooking.booking.client.dto;

import java.time.Instant;

public record BusyIntervalResponse(
        Instant start,
        Instant end
) {
}

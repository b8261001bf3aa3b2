package com.servicebooking.booking.api.dto;

import com.servicebooking.booking.domain.model.TemporalKey;

import java.time.Instant;
import java.time.LocalDate;

public record RescheduleRequest(
        LocalDate date,
        Instant start,
        Instant end
) {
    public TemporalKey temporalKey() {
        return TemporalKeyFields.toTemporalKey(date, start, end);
    }
}

package com.servicebooking.booking.api.dto;

import java.time.LocalDate;

/**
 * @param reason BLACKOUT or BOOKED when unavailable, null otherwise
 */
public record DateAvailabilityResponse(
        LocalDate date,
        boolean available,
        String reason
) {
    public static final String REASON_BLACKOUT = "BLACKOUT";
    public static final String REASON_BOOKED = "BOOKED";

    public static DateAvailabilityResponse available(LocalDate date) {
        return new DateAvailabilityResponse(date, true, null);
    }

    public static DateAvailabilityResponse unavailable(LocalDate date, String reason) {
        return new DateAvailabilityResponse(date, false, reason);
    }
}

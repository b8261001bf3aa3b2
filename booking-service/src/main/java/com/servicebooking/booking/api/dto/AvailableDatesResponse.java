package com.servicebooking.booking.api.dto;

import java.util.List;

public record AvailableDatesResponse(
        String tenantId,
        Long serviceId,
        String timezone,
        List<DateAvailabilityResponse> dates,
        boolean calendarDegraded
) {
}

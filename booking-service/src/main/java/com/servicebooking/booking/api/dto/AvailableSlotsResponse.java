package com.servicebooking.booking.api.dto;

import java.time.LocalDate;
import java.util.List;

public record AvailableSlotsResponse(
        String tenantId,
        Long serviceId,
        LocalDate date,
        String timezone,
        List<SlotResponse> slots,
        boolean calendarDegraded
) {
}

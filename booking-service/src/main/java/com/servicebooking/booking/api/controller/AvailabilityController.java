package com.servicebooking.booking.api.controller;

import com.servicebooking.booking.api.dto.AvailableDatesResponse;
import com.servicebooking.booking.api.dto.AvailableSlotsResponse;
import com.servicebooking.booking.api.dto.SlotResponse;
import com.servicebooking.booking.domain.service.AvailabilityResolver;
import com.servicebooking.common.dto.BaseResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Availability queries. A degraded external calendar still answers 200,
 * flagged through {@code degraded} in the envelope and {@code calendarDegraded} in the body.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/services/{serviceId}/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private static final String DEGRADED_MESSAGE = "External calendar unavailable, availability may be incomplete";

    private final AvailabilityResolver availabilityResolver;

    @GetMapping("/dates")
    public ResponseEntity<BaseResponse<AvailableDatesResponse>> getAvailableDates(
            @PathVariable String tenantId,
            @PathVariable Long serviceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {
        AvailableDatesResponse response = availabilityResolver.getAvailableDates(tenantId, serviceId, start, end);
        return ResponseEntity.ok(response.calendarDegraded()
                ? BaseResponse.degraded(DEGRADED_MESSAGE, response)
                : BaseResponse.success(response));
    }

    @GetMapping("/slots")
    public ResponseEntity<BaseResponse<AvailableSlotsResponse>> getAvailableSlots(
            @PathVariable String tenantId,
            @PathVariable Long serviceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        AvailableSlotsResponse response = availabilityResolver.getAvailableSlots(tenantId, serviceId, date);
        return ResponseEntity.ok(response.calendarDegraded()
                ? BaseResponse.degraded(DEGRADED_MESSAGE, response)
                : BaseResponse.success(response));
    }

    @GetMapping("/next-slot")
    public ResponseEntity<BaseResponse<SlotResponse>> getNextAvailableSlot(
            @PathVariable String tenantId,
            @PathVariable Long serviceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(defaultValue = "30") int maxDaysAhead) {
        return availabilityResolver.getNextAvailableSlot(tenantId, serviceId, from, maxDaysAhead)
                .map(slot -> ResponseEntity.ok(BaseResponse.success(slot)))
                .orElseGet(() -> ResponseEntity.ok(BaseResponse.success("No available slot in range", null)));
    }
}

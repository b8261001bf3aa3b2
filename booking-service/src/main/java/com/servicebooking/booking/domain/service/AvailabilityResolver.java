package com.servicebooking.booking.domain.service;

import com.servicebooking.booking.api.dto.AvailableDatesResponse;
import com.servicebooking.booking.api.dto.AvailableSlotsResponse;
import com.servicebooking.booking.api.dto.DateAvailabilityResponse;
import com.servicebooking.booking.api.dto.SlotResponse;
import com.servicebooking.booking.domain.model.AvailabilityRule;
import com.servicebooking.booking.domain.model.Booking;
import com.servicebooking.booking.domain.model.BookingMode;
import com.servicebooking.booking.domain.model.ServiceOffering;
import com.servicebooking.booking.domain.model.TimeRange;
import com.servicebooking.booking.domain.model.UnavailableSet;
import com.servicebooking.booking.domain.repository.AvailabilityRuleRepository;
import com.servicebooking.booking.domain.repository.BookingRepository;
import com.servicebooking.booking.domain.repository.ServiceOfferingRepository;
import com.servicebooking.common.exception.BusinessException;
import com.servicebooking.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes bookable dates (DATE offerings) and slots (TIMESLOT offerings).
 *
 * Results are a pure function of stored data and the external calendar: two calls with
 * no write in between return the same answer. Availability is advisory only; the
 * reservation itself is decided by the booking table's unique constraint.
 *
 * Days are walked with {@link LocalDate#plusDays(long)} and converted to instants in the
 * tenant's zone, so a range crossing a DST change yields 23 or 25 hour days, never a skipped
 * or repeated date.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityResolver {

    static final int MAX_RANGE_DAYS = 366;

    private final ServiceOfferingRepository offeringRepository;
    private final AvailabilityRuleRepository ruleRepository;
    private final BookingRepository bookingRepository;
    private final BlackoutCalendarMerger merger;
    private final TenantCalendarSettingsService settingsService;

    public AvailableDatesResponse getAvailableDates(String tenantId, Long serviceId,
                                                    LocalDate rangeStart, LocalDate rangeEnd) {
        validateRange(rangeStart, rangeEnd);
        ServiceOffering offering = loadOffering(tenantId, serviceId);
        requireMode(offering, BookingMode.DATE);
        ZoneId zone = settingsService.zoneFor(tenantId);

        if (!offering.isActive()) {
            log.debug("Offering {} of tenant {} is inactive, no dates available", serviceId, tenantId);
            return new AvailableDatesResponse(tenantId, serviceId, zone.getId(), List.of(), false);
        }

        Instant from = rangeStart.atStartOfDay(zone).toInstant();
        Instant to = rangeEnd.plusDays(1).atStartOfDay(zone).toInstant();
        UnavailableSet unavailable = merger.mergeUnavailable(tenantId, from, to);

        Set<LocalDate> booked = bookingRepository.findActiveDateBookings(tenantId, serviceId, rangeStart, rangeEnd)
                .stream()
                .map(Booking::getBookingDate)
                .collect(Collectors.toSet());

        List<DateAvailabilityResponse> days = new ArrayList<>();
        for (LocalDate day = rangeStart; !day.isAfter(rangeEnd); day = day.plusDays(1)) {
            Instant dayStart = day.atStartOfDay(zone).toInstant();
            Instant dayEnd = day.plusDays(1).atStartOfDay(zone).toInstant();
            if (unavailable.overlaps(dayStart, dayEnd)) {
                days.add(DateAvailabilityResponse.unavailable(day, DateAvailabilityResponse.REASON_BLACKOUT));
            } else if (booked.contains(day)) {
                days.add(DateAvailabilityResponse.unavailable(day, DateAvailabilityResponse.REASON_BOOKED));
            } else {
                days.add(DateAvailabilityResponse.available(day));
            }
        }
        return new AvailableDatesResponse(tenantId, serviceId, zone.getId(), days, unavailable.calendarDegraded());
    }

    public AvailableSlotsResponse getAvailableSlots(String tenantId, Long serviceId, LocalDate date) {
        ServiceOffering offering = loadOffering(tenantId, serviceId);
        requireMode(offering, BookingMode.TIMESLOT);
        ZoneId zone = settingsService.zoneFor(tenantId);

        if (!offering.isActive() || offering.durationOrZero() <= 0) {
            return new AvailableSlotsResponse(tenantId, serviceId, date, zone.getId(), List.of(), false);
        }

        List<AvailabilityRule> rules = ruleRepository.findApplicable(tenantId, serviceId, date.getDayOfWeek());
        List<TimeRange> candidates = tileSlots(rules, date, zone, offering.durationOrZero(), offering.bufferOrZero());
        if (candidates.isEmpty()) {
            return new AvailableSlotsResponse(tenantId, serviceId, date, zone.getId(), List.of(), false);
        }

        Instant dayStart = date.atStartOfDay(zone).toInstant();
        Instant dayEnd = date.plusDays(1).atStartOfDay(zone).toInstant();
        UnavailableSet unavailable = merger.mergeUnavailable(tenantId, dayStart, dayEnd);
        if (unavailable.covers(dayStart, dayEnd)) {
            log.debug("Tenant {} is blacked out on {}, no slots", tenantId, date);
            return new AvailableSlotsResponse(tenantId, serviceId, date, zone.getId(), List.of(),
                    unavailable.calendarDegraded());
        }

        List<TimeRange> held = bookingRepository.findActiveSlotBookingsOverlapping(tenantId, serviceId, dayStart, dayEnd)
                .stream()
                .map(b -> new TimeRange(b.getStartsAt(), b.getEndsAt()))
                .toList();

        List<SlotResponse> slots = new ArrayList<>(candidates.size());
        for (TimeRange slot : candidates) {
            boolean blocked = unavailable.overlaps(slot.start(), slot.end())
                    || held.stream().anyMatch(h -> h.overlaps(slot.start(), slot.end()));
            slots.add(new SlotResponse(slot.start(), slot.end(), !blocked));
        }
        return new AvailableSlotsResponse(tenantId, serviceId, date, zone.getId(), slots, unavailable.calendarDegraded());
    }

    /**
     * First available slot on or after {@code fromDate}, looking at most {@code maxDaysAhead} days ahead.
     */
    public Optional<SlotResponse> getNextAvailableSlot(String tenantId, Long serviceId, LocalDate fromDate, int maxDaysAhead) {
        for (int offset = 0; offset < maxDaysAhead; offset++) {
            AvailableSlotsResponse day = getAvailableSlots(tenantId, serviceId, fromDate.plusDays(offset));
            Optional<SlotResponse> first = day.slots().stream().filter(SlotResponse::available).findFirst();
            if (first.isPresent()) {
                return first;
            }
        }
        return Optional.empty();
    }

    /**
     * Tiles each operating window with {@code duration} long slots spaced {@code duration + buffer}
     * apart; a slot is kept only if it ends within its window. Slots from overlapping windows that
     * would overlap an earlier slot are dropped, so the result is chronological and disjoint.
     */
    static List<TimeRange> tileSlots(List<AvailabilityRule> rules, LocalDate date, ZoneId zone,
                                     int durationMinutes, int bufferMinutes) {
        List<TimeRange> tiled = new ArrayList<>();
        for (AvailabilityRule rule : rules) {
            int windowStart = rule.getStartTime().toSecondOfDay() / 60;
            int windowEnd = rule.getEndTime().toSecondOfDay() / 60;
            for (int minute = windowStart; minute + durationMinutes <= windowEnd; minute += durationMinutes + bufferMinutes) {
                Instant start = ZonedDateTime.of(date, LocalTime.ofSecondOfDay(minute * 60L), zone).toInstant();
                tiled.add(new TimeRange(start, start.plus(Duration.ofMinutes(durationMinutes))));
            }
        }
        tiled.sort(TimeRange.BY_START);

        List<TimeRange> disjoint = new ArrayList<>(tiled.size());
        Instant lastEnd = null;
        for (TimeRange slot : tiled) {
            if (lastEnd == null || !slot.start().isBefore(lastEnd)) {
                disjoint.add(slot);
                lastEnd = slot.end();
            }
        }
        return disjoint;
    }

    private ServiceOffering loadOffering(String tenantId, Long serviceId) {
        return offeringRepository.findByIdAndTenantId(serviceId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Service offering", serviceId));
    }

    private void requireMode(ServiceOffering offering, BookingMode expected) {
        if (offering.getMode() != expected) {
            throw new BusinessException(
                    String.format("Service offering %d is booked by %s, not %s", offering.getId(), offering.getMode(), expected),
                    "INVALID_BOOKING_MODE");
        }
    }

    private void validateRange(LocalDate rangeStart, LocalDate rangeEnd) {
        if (rangeStart == null || rangeEnd == null || rangeEnd.isBefore(rangeStart)) {
            throw new BusinessException("Range end must not be before range start", "INVALID_RANGE");
        }
        if (ChronoUnit.DAYS.between(rangeStart, rangeEnd) >= MAX_RANGE_DAYS) {
            throw new BusinessException("Range must not exceed " + MAX_RANGE_DAYS + " days", "INVALID_RANGE");
        }
    }
}

package com.servicebooking.booking.domain.strategy;

import com.servicebooking.booking.domain.model.Booking;
import com.servicebooking.booking.domain.repository.BookingRepository;
import com.servicebooking.booking.exception.SlotConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Reservation through the database's constraints on active holds.
 *
 * <pre>
 *   UNIQUE (tenant_id, service_id, slot_key, active_hold)
 *   EXCLUDE USING gist (tenant_id =, service_id =, tstzrange(starts_at, ends_at) &&) WHERE active_hold
 * </pre>
 *
 * The unique key covers dates and identical slot starts; the exclusion covers time slots that
 * overlap without sharing a start. Two concurrent inserts for the same slot both pass any
 * pre-check, but only one can commit the row: the other gets a constraint violation, reported
 * as {@link SlotConflictException}.
 * No read-then-write window exists, across threads or across service instances.
 */
@Slf4j
@Component("constraint")
@RequiredArgsConstructor
public class ConstraintReservationStrategy implements ReservationStrategy {

    static final String ACTIVE_SLOT_CONSTRAINT = "uk_booking_active_slot";
    static final String ACTIVE_RANGE_CONSTRAINT = "ex_booking_active_range";

    private final BookingRepository bookingRepository;

    @Override
    public Booking claimSlot(Booking booking) {
        try {
            return bookingRepository.saveAndFlush(booking);
        } catch (DataIntegrityViolationException e) {
            if (isActiveSlotViolation(e)) {
                log.info("Slot {} of service {} (tenant {}) already held, rejecting",
                        booking.getSlotKey(), booking.getServiceId(), booking.getTenantId());
                throw new SlotConflictException(
                        String.format("%s is no longer available, please choose another", booking.temporalKey()), e);
            }
            throw e;
        }
    }

    @Override
    public String getStrategyType() {
        return "UNIQUE_CONSTRAINT";
    }

    private boolean isActiveSlotViolation(DataIntegrityViolationException e) {
        String message = e.getMostSpecificCause().getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase();
        return lower.contains(ACTIVE_SLOT_CONSTRAINT) || lower.contains(ACTIVE_RANGE_CONSTRAINT);
    }
}

package com.servicebooking.booking.domain.strategy;

import com.servicebooking.booking.domain.model.Booking;

/**
 * Claims the slot described by a booking's temporal key.
 *
 * Implementations (bean names, selected by {@code booking.reservation.strategy}):
 * - constraint: insert/update guarded by uk_booking_active_slot and ex_booking_active_range
 * - distributed: Redisson lock on the slot key, then the same constrained write
 *
 * Whatever the strategy, the constrained write decides the outcome; a lock only reduces
 * contention before it.
 */
public interface ReservationStrategy {

    /**
     * Persists {@code booking} holding its slot.
     *
     * @return the persisted booking
     * @throws com.servicebooking.booking.exception.SlotConflictException if another active booking holds the slot
     */
    Booking claimSlot(Booking booking);

    /**
     * @return Strategy type (UNIQUE_CONSTRAINT, DISTRIBUTED_LOCK)
     */
    String getStrategyType();
}

package com.servicebooking.booking.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Booking lifecycle.
 *
 * <pre>
 * PENDING -> {DEPOSIT_PAID, PAID} -> CONFIRMED -> FULFILLED
 * CANCELED and REFUNDED are reachable from every non-terminal state.
 * </pre>
 *
 * Any transition missing from the table below is rejected by the ledger.
 */
public enum BookingStatus {
    PENDING,
    DEPOSIT_PAID,
    PAID,
    CONFIRMED,
    FULFILLED,
    CANCELED,
    REFUNDED;

    private static final Map<BookingStatus, Set<BookingStatus>> TRANSITIONS = new EnumMap<>(BookingStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(DEPOSIT_PAID, PAID, CANCELED, REFUNDED));
        TRANSITIONS.put(DEPOSIT_PAID, EnumSet.of(PAID, CONFIRMED, CANCELED, REFUNDED));
        TRANSITIONS.put(PAID, EnumSet.of(CONFIRMED, CANCELED, REFUNDED));
        TRANSITIONS.put(CONFIRMED, EnumSet.of(FULFILLED, CANCELED, REFUNDED));
        TRANSITIONS.put(FULFILLED, EnumSet.noneOf(BookingStatus.class));
        TRANSITIONS.put(CANCELED, EnumSet.noneOf(BookingStatus.class));
        TRANSITIONS.put(REFUNDED, EnumSet.noneOf(BookingStatus.class));
    }

    public boolean canTransitionTo(BookingStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<BookingStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Whether a booking in this status still holds exclusivity over its slot.
     * A FULFILLED booking keeps its slot (the service took place), only CANCELED and REFUNDED release it.
     */
    public boolean holdsSlot() {
        return this != CANCELED && this != REFUNDED;
    }
}

package com.servicebooking.booking.domain.model;

/**
 * Events that move a booking through its lifecycle, each with the status it targets.
 */
public enum LedgerEvent {
    DEPOSIT_CAPTURED(BookingStatus.DEPOSIT_PAID),
    PAYMENT_CAPTURED(BookingStatus.PAID),
    BALANCE_CAPTURED(BookingStatus.PAID),
    CONFIRM(BookingStatus.CONFIRMED),
    FULFILL(BookingStatus.FULFILLED),
    PAYMENT_FAILED(BookingStatus.CANCELED),
    CHECKOUT_EXPIRED(BookingStatus.CANCELED),
    REFUND_COMPLETED(BookingStatus.REFUNDED);

    private final BookingStatus targetStatus;

    LedgerEvent(BookingStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    public BookingStatus targetStatus() {
        return targetStatus;
    }

    /**
     * Legal predecessors. Failure and expiry events only make sense for a booking still awaiting
     * payment, and a balance only follows a deposit; everything else follows the status table.
     */
    public boolean isAllowedFrom(BookingStatus current) {
        return switch (this) {
            case PAYMENT_FAILED, CHECKOUT_EXPIRED, DEPOSIT_CAPTURED -> current == BookingStatus.PENDING;
            case BALANCE_CAPTURED -> current == BookingStatus.DEPOSIT_PAID;
            default -> current.canTransitionTo(targetStatus);
        };
    }

    public boolean capturesFunds() {
        return this == DEPOSIT_CAPTURED || this == PAYMENT_CAPTURED || this == BALANCE_CAPTURED;
    }
}

package com.servicebooking.booking.domain.model;

public enum RequestStatus {
    PENDING,
    APPROVED,
    DENIED,
    EXPIRED;

    public boolean isResolved() {
        return this != PENDING;
    }
}

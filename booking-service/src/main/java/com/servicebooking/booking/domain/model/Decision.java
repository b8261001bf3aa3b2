package com.servicebooking.booking.domain.model;

/**
 * Operator verdict on a negotiation request.
 */
public enum Decision {
    APPROVE(RequestStatus.APPROVED),
    DENY(RequestStatus.DENIED);

    private final RequestStatus resultingStatus;

    Decision(RequestStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public RequestStatus resultingStatus() {
        return resultingStatus;
    }
}

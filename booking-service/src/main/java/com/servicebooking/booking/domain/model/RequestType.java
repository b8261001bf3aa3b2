package com.servicebooking.booking.domain.model;

public enum RequestType {
    RESCHEDULE,
    ADD_ON,
    QUESTION,
    CHANGE_REQUEST,
    CANCELLATION,
    REFUND,
    OTHER
}

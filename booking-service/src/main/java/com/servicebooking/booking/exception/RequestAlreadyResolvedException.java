package com.servicebooking.booking.exception;

import com.servicebooking.booking.domain.model.RequestStatus;
import com.servicebooking.common.exception.ConflictException;
import lombok.Getter;

@Getter
public class RequestAlreadyResolvedException extends ConflictException {

    private final RequestStatus status;

    public RequestAlreadyResolvedException(Long requestId, RequestStatus status) {
        super(String.format("Request %d was already decided (%s)", requestId, status), "REQUEST_ALREADY_RESOLVED");
        this.status = status;
    }
}

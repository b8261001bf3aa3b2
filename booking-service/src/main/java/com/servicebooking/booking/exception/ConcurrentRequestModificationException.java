package com.servicebooking.booking.exception;

import com.servicebooking.common.exception.ConflictException;
import lombok.Getter;

/**
 * A decision was made against a stale version of a negotiation request.
 * Nothing was written; {@link #getCurrentVersion()} is the version to re-fetch and decide on.
 */
@Getter
public class ConcurrentRequestModificationException extends ConflictException {

    private final Long requestId;
    private final int currentVersion;

    public ConcurrentRequestModificationException(Long requestId, int expectedVersion, int currentVersion) {
        super(String.format("Request %d was modified concurrently (expected version %d, current version %d)",
                requestId, expectedVersion, currentVersion), "CONCURRENT_MODIFICATION");
        this.requestId = requestId;
        this.currentVersion = currentVersion;
    }
}

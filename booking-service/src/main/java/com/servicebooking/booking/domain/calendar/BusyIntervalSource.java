package com.servicebooking.booking.domain.calendar;

import java.time.Instant;

/**
 * Capability to read a tenant's external busy times.
 * Implementations never throw for an unreachable or missing calendar: they answer
 * {@link BusyIntervals#unavailable()} so availability can proceed on local data alone.
 */
public interface BusyIntervalSource {

    BusyIntervals fetchBusyIntervals(String tenantId, Instant from, Instant to);
}

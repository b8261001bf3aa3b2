package com.servicebooking.booking.domain.calendar;

import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Used for tenants without a connected calendar, and when calendar lookups are switched off.
 */
@Component
public class NotConfiguredBusyIntervalSource implements BusyIntervalSource {

    @Override
    public BusyIntervals fetchBusyIntervals(String tenantId, Instant from, Instant to) {
        return BusyIntervals.unavailable();
    }
}

package com.servicebooking.booking.job;

import com.servicebooking.booking.domain.service.BookingLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Releases slots held by PENDING bookings whose checkout was abandoned.
 * Backstop for missed checkout.session.expired deliveries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PendingHoldExpiryJob {

    private final BookingLedger bookingLedger;

    @Value("${booking.reservation.expiry-enabled:true}")
    private boolean enabled;

    @Scheduled(fixedDelayString = "${booking.reservation.expiry-job-interval-ms:300000}")
    public void releaseStaleHolds() {
        if (!enabled) return;
        try {
            bookingLedger.expireStaleHolds();
        } catch (Exception e) {
            log.error("Pending hold expiry run failed", e);
        }
    }
}

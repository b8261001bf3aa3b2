package com.servicebooking.booking.job;

import com.servicebooking.booking.domain.service.ConcurrentRequestArbiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Marks PENDING negotiation requests past their expiry as EXPIRED.
 * Reads already report lapsed requests as expired; this keeps the table in step.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NegotiationExpiryJob {

    private final ConcurrentRequestArbiter requestArbiter;

    @Value("${booking.negotiation.expiry-enabled:true}")
    private boolean enabled;

    @Scheduled(fixedDelayString = "${booking.negotiation.expiry-job-interval-ms:600000}")
    public void expireOverdueRequests() {
        if (!enabled) return;
        try {
            requestArbiter.expireOverdueRequests();
        } catch (Exception e) {
            log.error("Negotiation expiry run failed", e);
        }
    }
}

package com.servicebooking.booking.job;

import com.servicebooking.booking.domain.service.IdempotencyGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class IdempotencyCleanupJob {

    private final IdempotencyGate idempotencyGate;

    @Value("${booking.idempotency.cleanup-enabled:true}")
    private boolean enabled;

    @Scheduled(fixedDelayString = "${booking.idempotency.cleanup-interval-ms:3600000}")
    public void purgeExpiredRecords() {
        if (!enabled) return;
        try {
            int deleted = idempotencyGate.purgeExpired();
            if (deleted > 0) {
                log.info("Idempotency cleanup: deleted {} expired record(s)", deleted);
            }
        } catch (Exception e) {
            log.error("Idempotency cleanup failed", e);
        }
    }
}

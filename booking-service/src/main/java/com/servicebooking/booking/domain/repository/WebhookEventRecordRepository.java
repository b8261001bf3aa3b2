package com.servicebooking.booking.domain.repository;

import com.servicebooking.booking.domain.model.WebhookEventRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface WebhookEventRecordRepository extends JpaRepository<WebhookEventRecord, Long> {

    Optional<WebhookEventRecord> findByTenantIdAndEventId(String tenantId, String eventId);
}

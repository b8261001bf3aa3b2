package com.servicebooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Processed-event bookkeeping for payment provider deliveries, one row per (tenant, event id).
 */
@Entity
@Table(name = "webhook_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_webhook_tenant_event", columnNames = {"tenant_id", "event_id"}),
        indexes = @Index(name = "idx_webhook_status", columnList = "status"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEventRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "event_id", nullable = false, length = 255)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "booking_id")
    private Long bookingId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Status status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    /** Terminal outcomes short-circuit redeliveries; FAILED events are processed again. */
    public boolean isSettled() {
        return status == Status.PROCESSED || status == Status.IGNORED;
    }

    public enum Status {
        PROCESSED,
        IGNORED,
        FAILED
    }
}

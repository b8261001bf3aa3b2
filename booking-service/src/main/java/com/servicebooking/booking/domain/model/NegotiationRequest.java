package com.servicebooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Customer ask on an existing booking, decided once by the operator.
 *
 * {@code version} is a plain column compared and incremented by a conditional UPDATE
 * (see NegotiationRequestRepository#applyDecision), so a decision taken on a stale read
 * affects zero rows instead of overwriting the winner.
 */
@Entity
@Table(name = "negotiation_requests", indexes = {
        @Index(name = "idx_request_tenant_booking", columnList = "tenant_id, booking_id"),
        @Index(name = "idx_request_status_expires", columnList = "status, expires_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NegotiationRequest {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "booking_id", nullable = false)
    private Long bookingId;

    @Enumerated(EnumType.STRING)
    @Column(name = "request_type", nullable = false, length = 20)
    private RequestType type;

    @Column(name = "payload", columnDefinition = "TEXT")
    private String payload;

    @Column(name = "requested_by", length = 100)
    private String requestedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RequestStatus status;

    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "decided_by", length = 100)
    private String decidedBy;

    @Column(name = "decision_note", length = 1000)
    private String decisionNote;

    @Column(name = "decided_at")
    private LocalDateTime decidedAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null) {
            status = RequestStatus.PENDING;
        }
        if (version == null) {
            version = 1;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /** PENDING past its expiry, whether or not the sweep has marked it yet. */
    public boolean isLapsed(LocalDateTime now) {
        return status == RequestStatus.PENDING && !expiresAt.isAfter(now);
    }
}

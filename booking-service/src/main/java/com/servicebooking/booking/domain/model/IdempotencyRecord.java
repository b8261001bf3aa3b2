package com.servicebooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Stored outcome of an operation keyed by (tenant, client idempotency key).
 * The row is inserted IN_PROGRESS as the claim, and becomes COMPLETED with the serialized result.
 * Failed operations delete their claim, so failures are never replayed.
 */
@Entity
@Table(name = "idempotency_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_idempotency_tenant_key", columnNames = {"tenant_id", "idempotency_key"}),
        indexes = @Index(name = "idx_idempotency_expires_at", columnList = "expires_at"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "idempotency_key", nullable = false, length = 255)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Status status;

    @Column(name = "response_json", columnDefinition = "TEXT")
    private String responseJson;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    public boolean isExpired(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public static IdempotencyRecord claim(String tenantId, String idempotencyKey, LocalDateTime now, LocalDateTime expiresAt) {
        return IdempotencyRecord.builder()
                .tenantId(tenantId)
                .idempotencyKey(idempotencyKey)
                .status(Status.IN_PROGRESS)
                .createdAt(now)
                .expiresAt(expiresAt)
                .build();
    }

    public enum Status {
        IN_PROGRESS,
        COMPLETED
    }
}

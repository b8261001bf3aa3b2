package com.servicebooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Bookable unit of a tenant. Maintained by the catalog; the engine only reads it.
 */
@Entity
@Table(name = "service_offerings", indexes = {
        @Index(name = "idx_offering_tenant", columnList = "tenant_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceOffering {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "booking_mode", nullable = false, length = 16)
    private BookingMode mode;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(name = "buffer_minutes")
    private Integer bufferMinutes;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    /** Percentage of the price charged up front when the customer opts for a deposit; null disables deposits. */
    @Column(name = "deposit_percent")
    private Integer depositPercent;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    public int durationOrZero() {
        return durationMinutes == null ? 0 : durationMinutes;
    }

    public int bufferOrZero() {
        return bufferMinutes == null ? 0 : bufferMinutes;
    }
}

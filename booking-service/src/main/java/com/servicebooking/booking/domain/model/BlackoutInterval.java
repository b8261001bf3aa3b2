package com.servicebooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Operator-defined unavailability: either a whole calendar day ({@code blackoutDate})
 * or an explicit [startsAt, endsAt) interval.
 */
@Entity
@Table(name = "blackout_intervals",
        uniqueConstraints = @UniqueConstraint(name = "uk_blackout_tenant_date", columnNames = {"tenant_id", "blackout_date"}),
        indexes = @Index(name = "idx_blackout_tenant_range", columnList = "tenant_id, starts_at, ends_at"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlackoutInterval {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "blackout_date")
    private LocalDate blackoutDate;

    @Column(name = "starts_at")
    private Instant startsAt;

    @Column(name = "ends_at")
    private Instant endsAt;

    @Column(name = "reason", length = 500)
    private String reason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    public boolean isWholeDay() {
        return blackoutDate != null;
    }

    /**
     * Whole days span local midnight to the next local midnight, so a DST day is 23 or 25 hours long.
     */
    public TimeRange toTimeRange(ZoneId zone) {
        if (isWholeDay()) {
            return new TimeRange(
                    blackoutDate.atStartOfDay(zone).toInstant(),
                    blackoutDate.plusDays(1).atStartOfDay(zone).toInstant());
        }
        return new TimeRange(startsAt, endsAt);
    }
}

package com.servicebooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A reservation of one temporal key of a service offering.
 *
 * Slot exclusivity is enforced by {@code uk_booking_active_slot} over
 * (tenant_id, service_id, slot_key, active_hold): {@code activeHold} is TRUE while the
 * booking holds its slot and NULL once it is CANCELED or REFUNDED. NULLs never collide
 * in a unique index, so released slots can be booked again while the history row stays.
 * Time slots are additionally covered by {@code ex_booking_active_range}, which rejects an
 * active hold overlapping another active hold's [startsAt, endsAt) on the same service.
 */
@Entity
@Table(name = "bookings",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_booking_active_slot",
                        columnNames = {"tenant_id", "service_id", "slot_key", "active_hold"}),
                @UniqueConstraint(name = "uk_booking_confirmation_code", columnNames = "confirmation_code")
        },
        indexes = {
                @Index(name = "idx_booking_tenant_service_date", columnList = "tenant_id, service_id, booking_date"),
                @Index(name = "idx_booking_tenant_service_start", columnList = "tenant_id, service_id, starts_at"),
                @Index(name = "idx_booking_status_created", columnList = "status, created_at")
        })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "booking_mode", nullable = false, length = 16)
    private BookingMode mode;

    @Column(name = "slot_key", nullable = false, length = 64)
    private String slotKey;

    @Column(name = "booking_date")
    private LocalDate bookingDate;

    @Column(name = "starts_at")
    private Instant startsAt;

    @Column(name = "ends_at")
    private Instant endsAt;

    @Column(name = "active_hold")
    private Boolean activeHold;

    @Column(name = "confirmation_code", nullable = false, length = 16)
    private String confirmationCode;

    @Column(name = "customer_name", nullable = false, length = 200)
    private String customerName;

    @Column(name = "customer_email", nullable = false, length = 320)
    private String customerEmail;

    @Column(name = "customer_phone", length = 40)
    private String customerPhone;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "paid_amount", precision = 12, scale = 2)
    private BigDecimal paidAmount;

    @Column(name = "deposit", nullable = false)
    private boolean deposit;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "checkout_session_id", length = 255)
    private String checkoutSessionId;

    @Column(name = "payment_reference", length = 255)
    private String paymentReference;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancelled_by", length = 16)
    private CancelledBy cancelledBy;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "refund_status", nullable = false, length = 16)
    private RefundStatus refundStatus;

    @Column(name = "refund_amount", precision = 12, scale = 2)
    private BigDecimal refundAmount;

    @Column(name = "refunded_at")
    private LocalDateTime refundedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = BookingStatus.PENDING;
        }
        if (refundStatus == null) {
            refundStatus = RefundStatus.NONE;
        }
        activeHold = status.holdsSlot() ? Boolean.TRUE : null;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public TemporalKey temporalKey() {
        return mode == BookingMode.DATE
                ? TemporalKey.ofDate(bookingDate)
                : TemporalKey.ofSlot(startsAt, endsAt);
    }

    public void assignTemporalKey(TemporalKey key) {
        this.mode = key.mode();
        this.slotKey = key.slotKey();
        this.bookingDate = key.date();
        this.startsAt = key.start();
        this.endsAt = key.end();
    }

    /**
     * Moves to {@code target} and keeps {@code activeHold} in step with it.
     * Callers validate the transition first.
     */
    public void moveTo(BookingStatus target) {
        this.status = target;
        this.activeHold = target.holdsSlot() ? Boolean.TRUE : null;
    }

    public boolean hasCapturedFunds() {
        return paidAmount != null && paidAmount.signum() > 0;
    }

    public enum CancelledBy {
        CUSTOMER,
        TENANT,
        ADMIN,
        SYSTEM
    }

    public enum RefundStatus {
        NONE,
        PENDING,
        PROCESSING,
        COMPLETED,
        PARTIAL,
        FAILED
    }
}

package com.servicebooking.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published when a booking is cancelled, by any actor. The slot is free again once this is sent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingCancelledEvent {
    private Long bookingId;
    private String tenantId;
    private Long serviceId;
    private String slotKey;
    private String cancelledBy;
    private String reason;
    private String refundStatus;
    private BigDecimal refundAmount;
    private Instant timestamp;
}

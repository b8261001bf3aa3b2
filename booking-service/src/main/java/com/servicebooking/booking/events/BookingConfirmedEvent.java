package com.servicebooking.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Published when a booking reaches CONFIRMED.
 * Consumed by notification delivery and reporting, outside this engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingConfirmedEvent {
    private Long bookingId;
    private String tenantId;
    private Long serviceId;
    private String confirmationCode;
    private String bookingMode;
    private LocalDate bookingDate;
    private Instant startsAt;
    private Instant endsAt;
    private String customerEmail;
    private BigDecimal totalAmount;
    private BigDecimal paidAmount;
    private Instant timestamp;
}

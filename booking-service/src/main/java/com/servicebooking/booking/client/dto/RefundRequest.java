package com.servicebooking.booking.client.dto;

import java.math.BigDecimal;

public record RefundRequest(
        String tenantId,
        Long bookingId,
        String paymentReference,
        BigDecimal amount,
        String reason,
        String idempotencyKey
) {
}

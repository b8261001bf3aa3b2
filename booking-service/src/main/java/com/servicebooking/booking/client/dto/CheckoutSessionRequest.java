package com.servicebooking.booking.client.dto;

import java.math.BigDecimal;

public record CheckoutSessionRequest(
        String tenantId,
        Long bookingId,
        String confirmationCode,
        BigDecimal amount,
        boolean deposit,
        String customerEmail,
        String description,
        String idempotencyKey
) {
}

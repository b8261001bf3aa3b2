package com.servicebooking.booking.client.dto;

import java.math.BigDecimal;

/**
 * @param status COMPLETED, PARTIAL, PENDING or FAILED as reported by the payment collaborator
 */
public record RefundResponse(
        String refundId,
        String status,
        BigDecimal amount
) {
    public boolean isCompleted() {
        return "COMPLETED".equalsIgnoreCase(status);
    }

    public boolean isPartial() {
        return "PARTIAL".equalsIgnoreCase(status);
    }

    public boolean isFailed() {
        return "FAILED".equalsIgnoreCase(status);
    }
}

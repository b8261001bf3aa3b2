package com.servicebooking.booking.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A payment provider event whose signature was already verified upstream.
 * {@code metadata} carries what the checkout session was created with:
 * {@code bookingId}, {@code paymentType} (deposit | full) and {@code isBalancePayment}.
 */
public record VerifiedPaymentEvent(
        @NotBlank(message = "Event ID cannot be blank")
        String eventId,

        @NotBlank(message = "Event type cannot be blank")
        String type,

        @NotBlank(message = "Tenant ID cannot be blank")
        String tenantId,

        Map<String, String> metadata,

        BigDecimal amount,

        String paymentReference,

        String checkoutSessionId
) {
    public static final String TYPE_CHECKOUT_COMPLETED = "checkout.session.completed";
    public static final String TYPE_CHECKOUT_EXPIRED = "checkout.session.expired";
    public static final String TYPE_PAYMENT_FAILED = "payment_intent.payment_failed";
    public static final String TYPE_CHARGE_REFUNDED = "charge.refunded";

    public String metadataValue(String key) {
        return metadata == null ? null : metadata.get(key);
    }

    /** Booking id from metadata, or null when absent or malformed. */
    public Long bookingId() {
        String raw = metadataValue("bookingId");
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public boolean isDepositPayment() {
        return "deposit".equalsIgnoreCase(metadataValue("paymentType"));
    }

    public boolean isBalancePayment() {
        return Boolean.parseBoolean(metadataValue("isBalancePayment"));
    }
}

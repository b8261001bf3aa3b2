package com.servicebooking.booking.client.dto;

public record CheckoutSessionResponse(
        String sessionId,
        String checkoutUrl
) {
}

package com.servicebooking.booking.api.dto;

import com.servicebooking.booking.domain.model.Booking;
import com.servicebooking.booking.domain.model.BookingStatus;

import java.math.BigDecimal;

public record CheckoutResponse(
        Long bookingId,
        String confirmationCode,
        BookingStatus status,
        String slotKey,
        BigDecimal totalAmount,
        BigDecimal amountDue,
        boolean deposit,
        String checkoutSessionId,
        String checkoutUrl
) {
    public static CheckoutResponse from(Booking booking, BigDecimal amountDue, String checkoutUrl) {
        return new CheckoutResponse(
                booking.getId(),
                booking.getConfirmationCode(),
                booking.getStatus(),
                booking.getSlotKey(),
                booking.getTotalAmount(),
                amountDue,
                booking.isDeposit(),
                booking.getCheckoutSessionId(),
                checkoutUrl
        );
    }
}

package com.servicebooking.booking.api.dto;

import com.servicebooking.booking.domain.model.Booking;
import com.servicebooking.booking.domain.model.BookingMode;
import com.servicebooking.booking.domain.model.BookingStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record BookingResponse(
        Long id,
        String tenantId,
        Long serviceId,
        BookingMode mode,
        LocalDate bookingDate,
        Instant startsAt,
        Instant endsAt,
        String confirmationCode,
        String customerName,
        String customerEmail,
        BigDecimal totalAmount,
        BigDecimal paidAmount,
        boolean deposit,
        BookingStatus status,
        Booking.CancelledBy cancelledBy,
        String cancellationReason,
        Booking.RefundStatus refundStatus,
        BigDecimal refundAmount,
        LocalDateTime createdAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getTenantId(),
                booking.getServiceId(),
                booking.getMode(),
                booking.getBookingDate(),
                booking.getStartsAt(),
                booking.getEndsAt(),
                booking.getConfirmationCode(),
                booking.getCustomerName(),
                booking.getCustomerEmail(),
                booking.getTotalAmount(),
                booking.getPaidAmount(),
                booking.isDeposit(),
                booking.getStatus(),
                booking.getCancelledBy(),
                booking.getCancellationReason(),
                booking.getRefundStatus(),
                booking.getRefundAmount(),
                booking.getCreatedAt()
        );
    }
}

package com.servicebooking.booking.api.controller;

import com.servicebooking.booking.api.dto.BookingResponse;
import com.servicebooking.booking.api.dto.CancelBookingRequest;
import com.servicebooking.booking.api.dto.CheckoutResponse;
import com.servicebooking.booking.api.dto.CreateCheckoutRequest;
import com.servicebooking.booking.api.dto.RescheduleRequest;
import com.servicebooking.booking.domain.service.BookingLedger;
import com.servicebooking.booking.domain.service.CheckoutService;
import com.servicebooking.common.dto.BaseResponse;
import com.servicebooking.common.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final CheckoutService checkoutService;
    private final BookingLedger bookingLedger;

    /**
     * Reserves the slot and opens a payment checkout. Retries with the same
     * Idempotency-Key replay the first response.
     */
    @PostMapping("/checkout")
    public ResponseEntity<BaseResponse<CheckoutResponse>> checkout(
            @PathVariable String tenantId,
            @RequestHeader(Constants.HEADER_IDEMPOTENCY_KEY) String idempotencyKey,
            @Valid @RequestBody CreateCheckoutRequest request) {
        CheckoutResponse response = checkoutService.createCheckout(tenantId, idempotencyKey, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success("Checkout created", response));
    }

    @GetMapping("/{bookingId}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(
            @PathVariable String tenantId, @PathVariable Long bookingId) {
        return ResponseEntity.ok(BaseResponse.success(BookingResponse.from(bookingLedger.getBooking(tenantId, bookingId))));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<BookingResponse>>> listBookings(@PathVariable String tenantId) {
        List<BookingResponse> response = bookingLedger.listBookings(tenantId).stream()
                .map(BookingResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<BaseResponse<BookingResponse>> cancel(
            @PathVariable String tenantId,
            @PathVariable Long bookingId,
            @Valid @RequestBody CancelBookingRequest request) {
        BookingResponse response = BookingResponse.from(
                bookingLedger.cancel(tenantId, bookingId, request.cancelledBy(), request.reason()));
        return ResponseEntity.ok(BaseResponse.success("Booking cancelled", response));
    }

    @PostMapping("/{bookingId}/reschedule")
    public ResponseEntity<BaseResponse<BookingResponse>> reschedule(
            @PathVariable String tenantId,
            @PathVariable Long bookingId,
            @Valid @RequestBody RescheduleRequest request) {
        BookingResponse response = BookingResponse.from(
                bookingLedger.reschedule(tenantId, bookingId, request.temporalKey()));
        return ResponseEntity.ok(BaseResponse.success("Booking rescheduled", response));
    }
}

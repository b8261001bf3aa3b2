package com.servicebooking.booking.client;

import com.servicebooking.booking.client.dto.CheckoutSessionRequest;
import com.servicebooking.booking.client.dto.CheckoutSessionResponse;
import com.servicebooking.booking.client.dto.RefundRequest;
import com.servicebooking.booking.client.dto.RefundResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resilience4j-guarded access to {@link PaymentClient}.
 * Lives in its own bean so the retry and circuit breaker aspects apply (self-invocation bypasses proxies).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentGateway {

    private final PaymentClient paymentClient;

    @Retry(name = "payment-service")
    @CircuitBreaker(name = "payment-service")
    public CheckoutSessionResponse createCheckoutSession(CheckoutSessionRequest request) {
        log.debug("Requesting checkout session for booking {} (key {})", request.bookingId(), request.idempotencyKey());
        return paymentClient.createCheckoutSession(request);
    }

    @Retry(name = "payment-service")
    @CircuitBreaker(name = "payment-service")
    public RefundResponse refund(RefundRequest request) {
        log.debug("Requesting refund of {} for booking {} (key {})",
                request.amount(), request.bookingId(), request.idempotencyKey());
        return paymentClient.refund(request);
    }
}

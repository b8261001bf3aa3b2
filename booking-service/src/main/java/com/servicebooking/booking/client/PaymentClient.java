package com.servicebooking.booking.client;

import com.servicebooking.booking.client.dto.CheckoutSessionRequest;
import com.servicebooking.booking.client.dto.CheckoutSessionResponse;
import com.servicebooking.booking.client.dto.RefundRequest;
import com.servicebooking.booking.client.dto.RefundResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for the payment collaborator.
 * Both calls carry an idempotency key, so retries never open a second session or refund twice.
 */
@FeignClient(name = "payment-service", url = "${booking.clients.payment.url}", path = "/api/v1/payments")
public interface PaymentClient {

    @PostMapping("/checkout-sessions")
    CheckoutSessionResponse createCheckoutSession(@RequestBody CheckoutSessionRequest request);

    @PostMapping("/refunds")
    RefundResponse refund(@RequestBody RefundRequest request);
}

package com.servicebooking.booking.domain.service;

import com.servicebooking.booking.api.dto.CheckoutResponse;
import com.servicebooking.booking.api.dto.CreateCheckoutRequest;
import com.servicebooking.booking.client.PaymentGateway;
import com.servicebooking.booking.client.dto.CheckoutSessionRequest;
import com.servicebooking.booking.client.dto.CheckoutSessionResponse;
import com.servicebooking.booking.domain.model.Booking;
import com.servicebooking.booking.domain.model.ServiceOffering;
import com.servicebooking.booking.domain.model.TemporalKey;
import com.servicebooking.booking.domain.repository.ServiceOfferingRepository;
import com.servicebooking.common.exception.BusinessException;
import com.servicebooking.common.exception.ResourceNotFoundException;
import com.servicebooking.common.exception.ServiceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Checkout = reserve the slot, then open a payment checkout session for it.
 *
 * The whole sequence runs behind the IdempotencyGate, so a client retrying with the same
 * Idempotency-Key gets the original booking and checkout URL instead of a second hold.
 * If the payment provider cannot open a session, the fresh booking is cancelled by SYSTEM
 * (compensating action) and the failure propagates, which also releases the idempotency claim.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutService {

    private final IdempotencyGate idempotencyGate;
    private final BookingLedger bookingLedger;
    private final ServiceOfferingRepository offeringRepository;
    private final PaymentGateway paymentGateway;

    public CheckoutResponse createCheckout(String tenantId, String idempotencyKey, CreateCheckoutRequest request) {
        return idempotencyGate.execute(tenantId, idempotencyKey, CheckoutResponse.class,
                () -> doCheckout(tenantId, request));
    }

    private CheckoutResponse doCheckout(String tenantId, CreateCheckoutRequest request) {
        ServiceOffering offering = offeringRepository.findByIdAndTenantId(request.serviceId(), tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Service offering", request.serviceId()));
        TemporalKey key = request.temporalKey();
        BigDecimal total = offering.getPrice();
        BigDecimal amountDue = request.deposit() ? depositAmount(offering) : total;

        Booking booking = bookingLedger.reserve(tenantId, offering.getId(), key, request.customer(), total);

        CheckoutSessionResponse session;
        try {
            session = paymentGateway.createCheckoutSession(new CheckoutSessionRequest(
                    tenantId,
                    booking.getId(),
                    booking.getConfirmationCode(),
                    amountDue,
                    request.deposit(),
                    booking.getCustomerEmail(),
                    offering.getName() + " " + key,
                    "checkout-" + booking.getId()));
        } catch (RuntimeException e) {
            log.error("Checkout session for booking {} could not be created, releasing {}", booking.getId(), key, e);
            compensate(tenantId, booking.getId());
            throw new ServiceUnavailableException("Payment provider unavailable. The slot was released, please retry.", e);
        }

        Booking attached = bookingLedger.attachCheckoutSession(tenantId, booking.getId(), session.sessionId(), request.deposit());
        log.info("Checkout {} opened for booking {} ({} due)", session.sessionId(), attached.getId(), amountDue);
        return CheckoutResponse.from(attached, amountDue, session.checkoutUrl());
    }

    private BigDecimal depositAmount(ServiceOffering offering) {
        Integer percent = offering.getDepositPercent();
        if (percent == null || percent <= 0 || percent >= 100) {
            throw new BusinessException("Service offering " + offering.getId() + " does not take deposits",
                    "DEPOSIT_NOT_SUPPORTED");
        }
        return offering.getPrice()
                .multiply(BigDecimal.valueOf(percent))
                .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
    }

    private void compensate(String tenantId, Long bookingId) {
        try {
            bookingLedger.cancel(tenantId, bookingId, Booking.CancelledBy.SYSTEM, "Checkout session could not be created");
        } catch (RuntimeException e) {
            // the pending-hold expiry job releases it later
            log.error("Compensation failed for booking {}, slot stays held until hold expiry", bookingId, e);
        }
    }
}

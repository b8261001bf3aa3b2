package com.servicebooking.booking.api.controller;

import com.servicebooking.booking.api.dto.VerifiedPaymentEvent;
import com.servicebooking.booking.domain.model.WebhookEventRecord;
import com.servicebooking.booking.domain.service.WebhookReconciler;
import com.servicebooking.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives payment provider events after signature verification by the edge.
 * 200 for processed, ignored and duplicate events; failures surface as 5xx.
 */
@RestController
@RequestMapping("/internal/v1/payment-events")
@RequiredArgsConstructor
public class PaymentWebhookController {

    private final WebhookReconciler webhookReconciler;

    @PostMapping
    public ResponseEntity<BaseResponse<WebhookEventRecord.Status>> receive(@Valid @RequestBody VerifiedPaymentEvent event) {
        WebhookEventRecord.Status outcome = webhookReconciler.apply(event);
        return ResponseEntity.ok(BaseResponse.success(outcome));
    }
}

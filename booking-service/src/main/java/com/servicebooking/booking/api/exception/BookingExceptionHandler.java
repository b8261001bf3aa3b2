package com.servicebooking.booking.api.exception;

import com.servicebooking.booking.exception.ConcurrentRequestModificationException;
import com.servicebooking.booking.exception.InvalidTransitionException;
import com.servicebooking.booking.exception.WebhookProcessingException;
import com.servicebooking.common.dto.BaseResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Booking-specific mappings, consulted before the shared GlobalExceptionHandler.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BookingExceptionHandler {

    /** 409 with the current version so the client can re-fetch and decide again. */
    @ExceptionHandler(ConcurrentRequestModificationException.class)
    public ResponseEntity<BaseResponse<Map<String, Object>>> handleConcurrentModification(
            ConcurrentRequestModificationException ex) {
        log.warn("Concurrent modification of request {}: {}", ex.getRequestId(), ex.getMessage());
        BaseResponse<Map<String, Object>> response = BaseResponse.error(ex.getMessage(), ex.getErrorCode(),
                Map.of("requestId", ex.getRequestId(), "currentVersion", ex.getCurrentVersion()));
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<BaseResponse<?>> handleInvalidTransition(InvalidTransitionException ex) {
        BaseResponse<?> response = BaseResponse.error(ex.getMessage(), ex.getErrorCode());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
    }

    /** Non-2xx makes the payment provider keep the event and redeliver it. */
    @ExceptionHandler(WebhookProcessingException.class)
    public ResponseEntity<BaseResponse<?>> handleWebhookProcessing(WebhookProcessingException ex) {
        log.error("Payment event {} not applied, provider will redeliver", ex.getEventId());
        BaseResponse<?> response = BaseResponse.error(ex.getMessage(), "WEBHOOK_PROCESSING_FAILED");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}

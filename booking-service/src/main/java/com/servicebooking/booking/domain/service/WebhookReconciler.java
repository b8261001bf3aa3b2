package com.servicebooking.booking.domain.service;

import com.servicebooking.booking.api.dto.VerifiedPaymentEvent;
import com.servicebooking.booking.domain.model.LedgerEvent;
import com.servicebooking.booking.domain.model.WebhookEventRecord;
import com.servicebooking.booking.domain.model.WebhookEventRecord.Status;
import com.servicebooking.booking.domain.repository.WebhookEventRecordRepository;
import com.servicebooking.booking.exception.InvalidTransitionException;
import com.servicebooking.booking.exception.WebhookProcessingException;
import com.servicebooking.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Applies verified payment provider events to the booking ledger.
 *
 * Providers deliver at least once and in any order. Redeliveries of a settled event id are
 * recognised from the webhook_events table; ledger transitions are themselves idempotent
 * (same target or terminal booking is a no-op), so a redelivery racing the first delivery
 * is harmless as well.
 *
 * Failures other than an illegal transition are recorded FAILED and rethrown, which makes the
 * endpoint answer with an error and the provider redeliver.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookReconciler {

    private final BookingLedger bookingLedger;
    private final WebhookEventRecordRepository recordRepository;
    private final PlatformTransactionManager transactionManager;

    @Value("${booking.webhook.auto-confirm:true}")
    private boolean autoConfirm;

    public Status apply(VerifiedPaymentEvent event) {
        WebhookEventRecord existing = recordRepository
                .findByTenantIdAndEventId(event.tenantId(), event.eventId())
                .orElse(null);
        if (existing != null && existing.isSettled()) {
            log.warn("Duplicate delivery of event {} ({}), already {}", event.eventId(), event.type(), existing.getStatus());
            record(event, existing.getBookingId(), existing.getStatus(), existing.getLastError());
            return existing.getStatus();
        }

        Long bookingId = event.bookingId();
        List<LedgerEvent> ledgerEvents = ledgerEventsFor(event);
        if (ledgerEvents.isEmpty()) {
            log.info("Ignoring event {} of type {}", event.eventId(), event.type());
            return record(event, bookingId, Status.IGNORED, null);
        }
        if (bookingId == null) {
            log.warn("Event {} ({}) carries no booking id, ignoring", event.eventId(), event.type());
            return record(event, null, Status.IGNORED, "No bookingId in metadata");
        }

        try {
            for (LedgerEvent ledgerEvent : ledgerEvents) {
                bookingLedger.advance(event.tenantId(), bookingId, ledgerEvent, event.amount(), event.paymentReference());
            }
        } catch (InvalidTransitionException e) {
            return record(event, bookingId, Status.PROCESSED, "Rejected: " + e.getMessage());
        } catch (ResourceNotFoundException e) {
            log.warn("Event {} refers to unknown booking {} of tenant {}", event.eventId(), bookingId, event.tenantId());
            return record(event, bookingId, Status.IGNORED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to apply event {} ({}) to booking {}", event.eventId(), event.type(), bookingId, e);
            record(event, bookingId, Status.FAILED, e.getMessage());
            throw new WebhookProcessingException(event.eventId(), e);
        }

        log.info("Applied event {} ({}) to booking {}: {}", event.eventId(), event.type(), bookingId, ledgerEvents);
        return record(event, bookingId, Status.PROCESSED, null);
    }

    private List<LedgerEvent> ledgerEventsFor(VerifiedPaymentEvent event) {
        List<LedgerEvent> events = new ArrayList<>(2);
        switch (event.type()) {
            case VerifiedPaymentEvent.TYPE_CHECKOUT_COMPLETED -> {
                if (event.isBalancePayment()) {
                    events.add(LedgerEvent.BALANCE_CAPTURED);
                } else if (event.isDepositPayment()) {
                    events.add(LedgerEvent.DEPOSIT_CAPTURED);
                } else {
                    events.add(LedgerEvent.PAYMENT_CAPTURED);
                }
                // a deposit alone does not confirm
                if (autoConfirm && !events.contains(LedgerEvent.DEPOSIT_CAPTURED)) {
                    events.add(LedgerEvent.CONFIRM);
                }
            }
            case VerifiedPaymentEvent.TYPE_PAYMENT_FAILED -> events.add(LedgerEvent.PAYMENT_FAILED);
            case VerifiedPaymentEvent.TYPE_CHECKOUT_EXPIRED -> events.add(LedgerEvent.CHECKOUT_EXPIRED);
            case VerifiedPaymentEvent.TYPE_CHARGE_REFUNDED -> events.add(LedgerEvent.REFUND_COMPLETED);
            default -> {
            }
        }
        return events;
    }

    private Status record(VerifiedPaymentEvent event, Long bookingId, Status status, String error) {
        try {
            inNewTransaction(() -> upsert(event, bookingId, status, error));
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent delivery of event {} recorded first, updating its row", event.eventId());
            inNewTransaction(() -> upsert(event, bookingId, status, error));
        }
        return status;
    }

    private WebhookEventRecord upsert(VerifiedPaymentEvent event, Long bookingId, Status status, String error) {
        WebhookEventRecord record = recordRepository.findByTenantIdAndEventId(event.tenantId(), event.eventId())
                .orElseGet(() -> WebhookEventRecord.builder()
                        .tenantId(event.tenantId())
                        .eventId(event.eventId())
                        .eventType(event.type())
                        .build());
        // a settled outcome is never downgraded by a later delivery
        if (!record.isSettled() || record.getStatus() == status) {
            record.setStatus(status);
            record.setLastError(truncate(error));
        }
        record.setBookingId(bookingId);
        record.setAttempts(record.getAttempts() + 1);
        record.setProcessedAt(LocalDateTime.now());
        return recordRepository.saveAndFlush(record);
    }

    private <R> R inNewTransaction(Supplier<R> work) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template.execute(status -> work.get());
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 1000) {
            return message;
        }
        return message.substring(0, 1000);
    }
}

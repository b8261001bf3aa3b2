package com.servicebooking.booking.domain.service;

import com.servicebooking.booking.api.dto.VerifiedPaymentEvent;
import com.servicebooking.booking.domain.model.BookingStatus;
import com.servicebooking.booking.domain.model.LedgerEvent;
import com.servicebooking.booking.domain.model.WebhookEventRecord;
import com.servicebooking.booking.domain.model.WebhookEventRecord.Status;
import com.servicebooking.booking.domain.repository.WebhookEventRecordRepository;
import com.servicebooking.booking.exception.InvalidTransitionException;
import com.servicebooking.booking.exception.WebhookProcessingException;
import com.servicebooking.common.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class WebhookReconcilerTest {

    private static final String TENANT = "tenant-a";

    @Mock
    private BookingLedger bookingLedger;

    @Mock
    private WebhookEventRecordRepository recordRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private WebhookReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new WebhookReconciler(bookingLedger, recordRepository, transactionManager);
        ReflectionTestUtils.setField(reconciler, "autoConfirm", true);
        lenient().when(recordRepository.saveAndFlush(any(WebhookEventRecord.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static VerifiedPaymentEvent event(String id, String type, Map<String, String> metadata) {
        return new VerifiedPaymentEvent(id, type, TENANT, metadata, new BigDecimal("120.00"), "pi_9", "cs_9");
    }

    private WebhookEventRecord savedRecord() {
        ArgumentCaptor<WebhookEventRecord> captor = ArgumentCaptor.forClass(WebhookEventRecord.class);
        verify(recordRepository).saveAndFlush(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("a full payment captures and then confirms the booking")
    void apply_fullPayment() {
        given(recordRepository.findByTenantIdAndEventId(TENANT, "evt_1")).willReturn(Optional.empty());

        Status status = reconciler.apply(event("evt_1", VerifiedPaymentEvent.TYPE_CHECKOUT_COMPLETED,
                Map.of("bookingId", "12", "paymentType", "full")));

        assertThat(status).isEqualTo(Status.PROCESSED);
        InOrder order = inOrder(bookingLedger);
        order.verify(bookingLedger).advance(TENANT, 12L, LedgerEvent.PAYMENT_CAPTURED, new BigDecimal("120.00"), "pi_9");
        order.verify(bookingLedger).advance(TENANT, 12L, LedgerEvent.CONFIRM, new BigDecimal("120.00"), "pi_9");
        WebhookEventRecord record = savedRecord();
        assertThat(record.getStatus()).isEqualTo(Status.PROCESSED);
        assertThat(record.getBookingId()).isEqualTo(12L);
        assertThat(record.getAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("a deposit payment does not confirm the booking")
    void apply_depositDoesNotConfirm() {
        given(recordRepository.findByTenantIdAndEventId(TENANT, "evt_2")).willReturn(Optional.empty());

        reconciler.apply(event("evt_2", VerifiedPaymentEvent.TYPE_CHECKOUT_COMPLETED,
                Map.of("bookingId", "12", "paymentType", "deposit")));

        verify(bookingLedger).advance(TENANT, 12L, LedgerEvent.DEPOSIT_CAPTURED, new BigDecimal("120.00"), "pi_9");
        verify(bookingLedger, never()).advance(eq(TENANT), anyLong(), eq(LedgerEvent.CONFIRM), any(), any());
    }

    @Test
    @DisplayName("a balance payment captures the rest and confirms")
    void apply_balancePayment() {
        given(recordRepository.findByTenantIdAndEventId(TENANT, "evt_3")).willReturn(Optional.empty());

        reconciler.apply(event("evt_3", VerifiedPaymentEvent.TYPE_CHECKOUT_COMPLETED,
                Map.of("bookingId", "12", "paymentType", "deposit", "isBalancePayment", "true")));

        verify(bookingLedger).advance(TENANT, 12L, LedgerEvent.BALANCE_CAPTURED, new BigDecimal("120.00"), "pi_9");
        verify(bookingLedger).advance(TENANT, 12L, LedgerEvent.CONFIRM, new BigDecimal("120.00"), "pi_9");
    }

    @Test
    @DisplayName("with auto-confirm off a capture leaves the booking PAID")
    void apply_autoConfirmDisabled() {
        ReflectionTestUtils.setField(reconciler, "autoConfirm", false);
        given(recordRepository.findByTenantIdAndEventId(TENANT, "evt_4")).willReturn(Optional.empty());

        reconciler.apply(event("evt_4", VerifiedPaymentEvent.TYPE_CHECKOUT_COMPLETED, Map.of("bookingId", "12")));

        verify(bookingLedger).advance(TENANT, 12L, LedgerEvent.PAYMENT_CAPTURED, new BigDecimal("120.00"), "pi_9");
        verify(bookingLedger, never()).advance(eq(TENANT), anyLong(), eq(LedgerEvent.CONFIRM), any(), any());
    }

    @Test
    @DisplayName("failure, expiry and refund events map to their ledger events")
    void apply_otherEventTypes() {
        given(recordRepository.findByTenantIdAndEventId(eq(TENANT), any())).willReturn(Optional.empty());
        Map<String, String> metadata = Map.of("bookingId", "12");

        reconciler.apply(event("evt_5", VerifiedPaymentEvent.TYPE_PAYMENT_FAILED, metadata));
        reconciler.apply(event("evt_6", VerifiedPaymentEvent.TYPE_CHECKOUT_EXPIRED, metadata));
        reconciler.apply(event("evt_7", VerifiedPaymentEvent.TYPE_CHARGE_REFUNDED, metadata));

        verify(bookingLedger).advance(TENANT, 12L, LedgerEvent.PAYMENT_FAILED, new BigDecimal("120.00"), "pi_9");
        verify(bookingLedger).advance(TENANT, 12L, LedgerEvent.CHECKOUT_EXPIRED, new BigDecimal("120.00"), "pi_9");
        verify(bookingLedger).advance(TENANT, 12L, LedgerEvent.REFUND_COMPLETED, new BigDecimal("120.00"), "pi_9");
    }

    @Test
    @DisplayName("a redelivered settled event is not applied again, only counted")
    void apply_duplicate() {
        WebhookEventRecord settled = WebhookEventRecord.builder()
                .tenantId(TENANT).eventId("evt_1").eventType(VerifiedPaymentEvent.TYPE_CHECKOUT_COMPLETED)
                .bookingId(12L).status(Status.PROCESSED).attempts(1).build();
        given(recordRepository.findByTenantIdAndEventId(TENANT, "evt_1")).willReturn(Optional.of(settled));

        Status status = reconciler.apply(event("evt_1", VerifiedPaymentEvent.TYPE_CHECKOUT_COMPLETED,
                Map.of("bookingId", "12")));

        assertThat(status).isEqualTo(Status.PROCESSED);
        verify(bookingLedger, never()).advance(any(), any(), any(), any(), any());
        assertThat(settled.getAttempts()).isEqualTo(2);
        assertThat(settled.getStatus()).isEqualTo(Status.PROCESSED);
    }

    @Test
    @DisplayName("a previously FAILED event is processed again")
    void apply_retriesFailed() {
        WebhookEventRecord failed = WebhookEventRecord.builder()
                .tenantId(TENANT).eventId("evt_8").eventType(VerifiedPaymentEvent.TYPE_CHECKOUT_EXPIRED)
                .bookingId(12L).status(Status.FAILED).attempts(1).lastError("db down").build();
        given(recordRepository.findByTenantIdAndEventId(TENANT, "evt_8")).willReturn(Optional.of(failed));

        Status status = reconciler.apply(event("evt_8", VerifiedPaymentEvent.TYPE_CHECKOUT_EXPIRED, Map.of("bookingId", "12")));

        assertThat(status).isEqualTo(Status.PROCESSED);
        verify(bookingLedger).advance(TENANT, 12L, LedgerEvent.CHECKOUT_EXPIRED, new BigDecimal("120.00"), "pi_9");
        assertThat(failed.getStatus()).isEqualTo(Status.PROCESSED);
        assertThat(failed.getLastError()).isNull();
        assertThat(failed.getAttempts()).isEqualTo(2);
    }

    @Test
    @DisplayName("unhandled event types are recorded IGNORED")
    void apply_unknownType() {
        given(recordRepository.findByTenantIdAndEventId(TENANT, "evt_9")).willReturn(Optional.empty());

        Status status = reconciler.apply(event("evt_9", "customer.created", Map.of()));

        assertThat(status).isEqualTo(Status.IGNORED);
        verify(bookingLedger, never()).advance(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("an event without a usable booking id is recorded IGNORED")
    void apply_missingBookingId() {
        given(recordRepository.findByTenantIdAndEventId(TENANT, "evt_10")).willReturn(Optional.empty());

        Status status = reconciler.apply(event("evt_10", VerifiedPaymentEvent.TYPE_CHECKOUT_COMPLETED,
                Map.of("bookingId", "not-a-number")));

        assertThat(status).isEqualTo(Status.IGNORED);
        assertThat(savedRecord().getLastError()).isEqualTo("No bookingId in metadata");
    }

    @Test
    @DisplayName("an event for an unknown booking is recorded IGNORED")
    void apply_unknownBooking() {
        given(recordRepository.findByTenantIdAndEventId(TENANT, "evt_11")).willReturn(Optional.empty());
        given(bookingLedger.advance(TENANT, 404L, LedgerEvent.PAYMENT_FAILED, new BigDecimal("120.00"), "pi_9"))
                .willThrow(new ResourceNotFoundException("Booking", 404L));

        Status status = reconciler.apply(event("evt_11", VerifiedPaymentEvent.TYPE_PAYMENT_FAILED, Map.of("bookingId", "404")));

        assertThat(status).isEqualTo(Status.IGNORED);
    }

    @Test
    @DisplayName("an out-of-order event rejected by the ledger is settled, not retried")
    void apply_invalidTransition() {
        given(recordRepository.findByTenantIdAndEventId(TENANT, "evt_12")).willReturn(Optional.empty());
        given(bookingLedger.advance(TENANT, 12L, LedgerEvent.PAYMENT_FAILED, new BigDecimal("120.00"), "pi_9"))
                .willThrow(new InvalidTransitionException(12L, BookingStatus.CONFIRMED, BookingStatus.CANCELED));

        Status status = reconciler.apply(event("evt_12", VerifiedPaymentEvent.TYPE_PAYMENT_FAILED, Map.of("bookingId", "12")));

        assertThat(status).isEqualTo(Status.PROCESSED);
        assertThat(savedRecord().getLastError()).startsWith("Rejected:");
    }

    @Test
    @DisplayName("an unexpected failure is recorded FAILED and rethrown so the provider redelivers")
    void apply_failure() {
        given(recordRepository.findByTenantIdAndEventId(TENANT, "evt_13")).willReturn(Optional.empty());
        given(bookingLedger.advance(TENANT, 12L, LedgerEvent.CHECKOUT_EXPIRED, new BigDecimal("120.00"), "pi_9"))
                .willThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> reconciler.apply(event("evt_13", VerifiedPaymentEvent.TYPE_CHECKOUT_EXPIRED,
                Map.of("bookingId", "12"))))
                .isInstanceOf(WebhookProcessingException.class)
                .hasMessageContaining("evt_13");

        WebhookEventRecord record = savedRecord();
        assertThat(record.getStatus()).isEqualTo(Status.FAILED);
        assertThat(record.getLastError()).isEqualTo("connection reset");
    }
}

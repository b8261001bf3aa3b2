package com.servicebooking.booking.domain.service;

import com.servicebooking.booking.client.PaymentGateway;
import com.servicebooking.booking.client.dto.RefundRequest;
import com.servicebooking.booking.client.dto.RefundResponse;
import com.servicebooking.booking.domain.model.BlackoutInterval;
import com.servicebooking.booking.domain.model.Booking;
import com.servicebooking.booking.domain.model.Booking.CancelledBy;
import com.servicebooking.booking.domain.model.Booking.RefundStatus;
import com.servicebooking.booking.domain.model.BookingMode;
import com.servicebooking.booking.domain.model.BookingStatus;
import com.servicebooking.booking.domain.model.CustomerInfo;
import com.servicebooking.booking.domain.model.LedgerEvent;
import com.servicebooking.booking.domain.model.ServiceOffering;
import com.servicebooking.booking.domain.model.TemporalKey;
import com.servicebooking.booking.domain.repository.BlackoutIntervalRepository;
import com.servicebooking.booking.domain.repository.BookingRepository;
import com.servicebooking.booking.domain.repository.ServiceOfferingRepository;
import com.servicebooking.booking.domain.strategy.ReservationStrategy;
import com.servicebooking.booking.events.BookingCancelledEvent;
import com.servicebooking.booking.events.BookingConfirmedEvent;
import com.servicebooking.booking.exception.BookingStateConflictException;
import com.servicebooking.booking.exception.InvalidTransitionException;
import com.servicebooking.booking.exception.SlotConflictException;
import com.servicebooking.common.exception.BusinessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BookingLedgerTest {

    private static final String TENANT = "tenant-a";
    private static final Long SERVICE_ID = 7L;
    private static final LocalDate DAY = LocalDate.of(2026, 6, 1);
    private static final CustomerInfo CUSTOMER = new CustomerInfo("Ada", "ada@example.com", null);

    @Mock
    private ReservationStrategy reservationStrategy;

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private ServiceOfferingRepository offeringRepository;

    @Mock
    private BlackoutIntervalRepository blackoutRepository;

    @Mock
    private TenantCalendarSettingsService settingsService;

    @Mock
    private PaymentGateway paymentGateway;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private PlatformTransactionManager transactionManager;

    private BookingLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new BookingLedger(Map.of("constraint", reservationStrategy), bookingRepository, offeringRepository,
                blackoutRepository, settingsService, paymentGateway, eventPublisher, transactionManager);
        ReflectionTestUtils.setField(ledger, "strategyType", "constraint");
        ReflectionTestUtils.setField(ledger, "pendingHoldTtlMinutes", 60L);
    }

    private static Booking booking(BookingStatus status) {
        Booking booking = Booking.builder()
                .id(1L)
                .tenantId(TENANT)
                .serviceId(SERVICE_ID)
                .confirmationCode("ABCD2345")
                .customerEmail("ada@example.com")
                .totalAmount(BigDecimal.valueOf(200))
                .status(status)
                .activeHold(status.holdsSlot() ? Boolean.TRUE : null)
                .refundStatus(RefundStatus.NONE)
                .createdAt(LocalDateTime.now().minusHours(2))
                .build();
        booking.assignTemporalKey(TemporalKey.ofDate(DAY));
        return booking;
    }

    private void givenLocked(Booking booking) {
        given(bookingRepository.findByIdAndTenantIdForUpdate(booking.getId(), TENANT)).willReturn(Optional.of(booking));
    }

    private void givenSaveReturnsArgument() {
        given(bookingRepository.save(any(Booking.class))).willAnswer(inv -> inv.getArgument(0));
    }

    @Nested
    class Reserve {

        private ServiceOffering offering(BookingMode mode, boolean active) {
            return ServiceOffering.builder().id(SERVICE_ID).tenantId(TENANT).mode(mode).active(active)
                    .price(BigDecimal.valueOf(200)).build();
        }

        @Test
        @DisplayName("reserve() claims the slot as a PENDING booking holding it")
        void reserve_success() {
            given(offeringRepository.findByIdAndTenantId(SERVICE_ID, TENANT)).willReturn(Optional.of(offering(BookingMode.DATE, true)));
            given(settingsService.zoneFor(TENANT)).willReturn(ZoneOffset.UTC);
            given(blackoutRepository.findOverlapping(any(), any(), any(), any(), any())).willReturn(List.of());
            given(bookingRepository.existsActiveHold(TENANT, SERVICE_ID, "2026-06-01")).willReturn(false);
            given(reservationStrategy.claimSlot(any(Booking.class))).willAnswer(inv -> {
                Booking b = inv.getArgument(0);
                b.setId(5L);
                return b;
            });

            Booking result = ledger.reserve(TENANT, SERVICE_ID, TemporalKey.ofDate(DAY), CUSTOMER, BigDecimal.valueOf(200));

            assertThat(result.getId()).isEqualTo(5L);
            assertThat(result.getStatus()).isEqualTo(BookingStatus.PENDING);
            assertThat(result.getActiveHold()).isTrue();
            assertThat(result.getSlotKey()).isEqualTo("2026-06-01");
            assertThat(result.getConfirmationCode()).hasSize(8);
        }

        @Test
        @DisplayName("reserve() fails fast with SlotConflict when the slot is already held")
        void reserve_slotHeld() {
            given(offeringRepository.findByIdAndTenantId(SERVICE_ID, TENANT)).willReturn(Optional.of(offering(BookingMode.DATE, true)));
            given(settingsService.zoneFor(TENANT)).willReturn(ZoneOffset.UTC);
            given(blackoutRepository.findOverlapping(any(), any(), any(), any(), any())).willReturn(List.of());
            given(bookingRepository.existsActiveHold(TENANT, SERVICE_ID, "2026-06-01")).willReturn(true);

            assertThatThrownBy(() -> ledger.reserve(TENANT, SERVICE_ID, TemporalKey.ofDate(DAY), CUSTOMER, BigDecimal.TEN))
                    .isInstanceOf(SlotConflictException.class);
            verify(reservationStrategy, never()).claimSlot(any());
        }

        @Test
        @DisplayName("reserve() rejects a date under an operator blackout")
        void reserve_blackedOut() {
            given(offeringRepository.findByIdAndTenantId(SERVICE_ID, TENANT)).willReturn(Optional.of(offering(BookingMode.DATE, true)));
            given(settingsService.zoneFor(TENANT)).willReturn(ZoneOffset.UTC);
            given(blackoutRepository.findOverlapping(any(), any(), any(), any(), any())).willReturn(List.of(
                    BlackoutInterval.builder().tenantId(TENANT).blackoutDate(DAY).reason("Holiday").build()));

            assertThatThrownBy(() -> ledger.reserve(TENANT, SERVICE_ID, TemporalKey.ofDate(DAY), CUSTOMER, BigDecimal.TEN))
                    .isInstanceOf(SlotConflictException.class)
                    .hasMessageContaining("Holiday");
        }

        @Test
        @DisplayName("reserve() checks TIMESLOT keys against overlapping active bookings")
        void reserve_overlappingSlot() {
            Instant start = Instant.parse("2026-06-01T09:30:00Z");
            given(offeringRepository.findByIdAndTenantId(SERVICE_ID, TENANT)).willReturn(Optional.of(offering(BookingMode.TIMESLOT, true)));
            given(settingsService.zoneFor(TENANT)).willReturn(ZoneOffset.UTC);
            given(blackoutRepository.findOverlapping(any(), any(), any(), any(), any())).willReturn(List.of());
            Booking other = booking(BookingStatus.CONFIRMED);
            other.setId(99L);
            given(bookingRepository.findActiveSlotBookingsOverlapping(TENANT, SERVICE_ID, start, start.plusSeconds(3600)))
                    .willReturn(List.of(other));

            assertThatThrownBy(() -> ledger.reserve(TENANT, SERVICE_ID, TemporalKey.ofSlot(start, start.plusSeconds(3600)), CUSTOMER, BigDecimal.TEN))
                    .isInstanceOf(SlotConflictException.class);
        }

        @Test
        @DisplayName("reserve() refuses inactive offerings and mismatched keys")
        void reserve_rejectsInvalidOffering() {
            given(offeringRepository.findByIdAndTenantId(SERVICE_ID, TENANT)).willReturn(
                    Optional.of(offering(BookingMode.DATE, false)),
                    Optional.of(offering(BookingMode.TIMESLOT, true)));

            assertThatThrownBy(() -> ledger.reserve(TENANT, SERVICE_ID, TemporalKey.ofDate(DAY), CUSTOMER, BigDecimal.TEN))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo("OFFERING_INACTIVE");
            assertThatThrownBy(() -> ledger.reserve(TENANT, SERVICE_ID, TemporalKey.ofDate(DAY), CUSTOMER, BigDecimal.TEN))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode").isEqualTo("INVALID_BOOKING_MODE");
        }
    }

    @Nested
    class Advance {

        @Test
        @DisplayName("payment capture moves PENDING to PAID and records the captured amount")
        void advance_paymentCaptured() {
            Booking booking = booking(BookingStatus.PENDING);
            givenLocked(booking);
            givenSaveReturnsArgument();

            Booking result = ledger.advance(TENANT, 1L, LedgerEvent.PAYMENT_CAPTURED, BigDecimal.valueOf(200), "pi_123");

            assertThat(result.getStatus()).isEqualTo(BookingStatus.PAID);
            assertThat(result.getPaidAmount()).isEqualByComparingTo("200");
            assertThat(result.getPaymentReference()).isEqualTo("pi_123");
            verify(eventPublisher, never()).publishEvent(any());
        }

        @Test
        @DisplayName("a balance after a deposit adds up to the total")
        void advance_depositThenBalance() {
            Booking booking = booking(BookingStatus.PENDING);
            givenLocked(booking);
            givenSaveReturnsArgument();

            ledger.advance(TENANT, 1L, LedgerEvent.DEPOSIT_CAPTURED, BigDecimal.valueOf(50), null);
            Booking result = ledger.advance(TENANT, 1L, LedgerEvent.BALANCE_CAPTURED, null, null);

            assertThat(result.getStatus()).isEqualTo(BookingStatus.PAID);
            assertThat(result.isDeposit()).isTrue();
            assertThat(result.getPaidAmount()).isEqualByComparingTo("200");
        }

        @Test
        @DisplayName("confirming publishes a booking-confirmed event")
        void advance_confirmPublishes() {
            Booking booking = booking(BookingStatus.PAID);
            givenLocked(booking);
            givenSaveReturnsArgument();

            ledger.advance(TENANT, 1L, LedgerEvent.CONFIRM);

            ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
            verify(eventPublisher).publishEvent(event.capture());
            assertThat(event.getValue()).isInstanceOf(BookingConfirmedEvent.class);
            assertThat(((BookingConfirmedEvent) event.getValue()).getConfirmationCode()).isEqualTo("ABCD2345");
        }

        @Test
        @DisplayName("a repeated event for the current status is a no-op")
        void advance_sameTargetIsNoOp() {
            Booking booking = booking(BookingStatus.PAID);
            booking.setPaidAmount(BigDecimal.valueOf(200));
            givenLocked(booking);

            Booking result = ledger.advance(TENANT, 1L, LedgerEvent.PAYMENT_CAPTURED, BigDecimal.valueOf(200), null);

            assertThat(result.getPaidAmount()).isEqualByComparingTo("200");
            verify(bookingRepository, never()).save(any());
        }

        @Test
        @DisplayName("events on a terminal booking are ignored")
        void advance_terminalIsNoOp() {
            Booking booking = booking(BookingStatus.CANCELED);
            givenLocked(booking);

            Booking result = ledger.advance(TENANT, 1L, LedgerEvent.CONFIRM);

            assertThat(result.getStatus()).isEqualTo(BookingStatus.CANCELED);
            verify(bookingRepository, never()).save(any());
        }

        @Test
        @DisplayName("an illegal transition is rejected with InvalidTransitionException")
        void advance_illegal() {
            Booking booking = booking(BookingStatus.PENDING);
            givenLocked(booking);

            assertThatThrownBy(() -> ledger.advance(TENANT, 1L, LedgerEvent.FULFILL))
                    .isInstanceOf(InvalidTransitionException.class)
                    .extracting("errorCode")
                    .isEqualTo("INVALID_TRANSITION");
            assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        }

        @Test
        @DisplayName("a late payment failure cannot cancel a paid booking")
        void advance_lateFailureRejected() {
            Booking booking = booking(BookingStatus.PAID);
            givenLocked(booking);

            assertThatThrownBy(() -> ledger.advance(TENANT, 1L, LedgerEvent.PAYMENT_FAILED))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("checkout expiry cancels by SYSTEM and releases the slot")
        void advance_checkoutExpired() {
            Booking booking = booking(BookingStatus.PENDING);
            givenLocked(booking);
            givenSaveReturnsArgument();

            Booking result = ledger.advance(TENANT, 1L, LedgerEvent.CHECKOUT_EXPIRED);

            assertThat(result.getStatus()).isEqualTo(BookingStatus.CANCELED);
            assertThat(result.getActiveHold()).isNull();
            assertThat(result.getCancelledBy()).isEqualTo(CancelledBy.SYSTEM);
            verify(eventPublisher).publishEvent(any(BookingCancelledEvent.class));
        }
    }

    @Nested
    class Cancel {

        @Test
        @DisplayName("cancelling without captured funds releases the slot and requests no refund")
        void cancel_noFunds() {
            Booking booking = booking(BookingStatus.PENDING);
            givenLocked(booking);
            givenSaveReturnsArgument();

            Booking result = ledger.cancel(TENANT, 1L, CancelledBy.CUSTOMER, "Changed plans");

            assertThat(result.getStatus()).isEqualTo(BookingStatus.CANCELED);
            assertThat(result.getActiveHold()).isNull();
            assertThat(result.getRefundStatus()).isEqualTo(RefundStatus.NONE);
            verify(paymentGateway, never()).refund(any());
        }

        @Test
        @DisplayName("cancelling a paid booking requests a refund with a stable key and records the outcome")
        void cancel_withFundsRefunds() {
            Booking booking = booking(BookingStatus.CONFIRMED);
            booking.setPaidAmount(BigDecimal.valueOf(200));
            booking.setPaymentReference("pi_1");
            givenLocked(booking);
            givenSaveReturnsArgument();
            given(paymentGateway.refund(any(RefundRequest.class)))
                    .willReturn(new RefundResponse("re_1", "COMPLETED", BigDecimal.valueOf(200)));

            Booking result = ledger.cancel(TENANT, 1L, CancelledBy.TENANT, "Studio closed");

            ArgumentCaptor<RefundRequest> request = ArgumentCaptor.forClass(RefundRequest.class);
            verify(paymentGateway).refund(request.capture());
            assertThat(request.getValue().idempotencyKey()).isEqualTo("refund-1");
            assertThat(request.getValue().amount()).isEqualByComparingTo("200");
            assertThat(result.getStatus()).isEqualTo(BookingStatus.CANCELED);
            assertThat(result.getRefundStatus()).isEqualTo(RefundStatus.COMPLETED);
            assertThat(result.getRefundAmount()).isEqualByComparingTo("200");
        }

        @Test
        @DisplayName("a failing refund is recorded FAILED and the cancellation stands")
        void cancel_refundFailureKeepsCancellation() {
            Booking booking = booking(BookingStatus.PAID);
            booking.setPaidAmount(BigDecimal.valueOf(200));
            givenLocked(booking);
            givenSaveReturnsArgument();
            given(paymentGateway.refund(any(RefundRequest.class))).willThrow(new IllegalStateException("provider down"));

            Booking result = ledger.cancel(TENANT, 1L, CancelledBy.CUSTOMER, null);

            assertThat(result.getStatus()).isEqualTo(BookingStatus.CANCELED);
            assertThat(result.getRefundStatus()).isEqualTo(RefundStatus.FAILED);
        }

        @Test
        @DisplayName("cancelling a terminal booking is a conflict")
        void cancel_terminal() {
            givenLocked(booking(BookingStatus.FULFILLED));

            assertThatThrownBy(() -> ledger.cancel(TENANT, 1L, CancelledBy.CUSTOMER, "late"))
                    .isInstanceOf(BookingStateConflictException.class)
                    .extracting("errorCode")
                    .isEqualTo("BOOKING_CONFLICT");
        }
    }

    @Test
    @DisplayName("reschedule() moves the booking to a free key through the reservation strategy")
    void reschedule_success() {
        Booking booking = booking(BookingStatus.CONFIRMED);
        LocalDate newDay = DAY.plusDays(3);
        givenLocked(booking);
        given(settingsService.zoneFor(TENANT)).willReturn(ZoneOffset.UTC);
        given(blackoutRepository.findOverlapping(any(), any(), any(), any(), any())).willReturn(List.of());
        given(bookingRepository.findActiveDateBookings(TENANT, SERVICE_ID, newDay, newDay)).willReturn(List.of());
        given(reservationStrategy.claimSlot(booking)).willReturn(booking);

        Booking result = ledger.reschedule(TENANT, 1L, TemporalKey.ofDate(newDay));

        assertThat(result.getBookingDate()).isEqualTo(newDay);
        assertThat(result.getSlotKey()).isEqualTo("2026-06-04");
    }

    @Test
    @DisplayName("reschedule() onto a held date is a slot conflict")
    void reschedule_conflict() {
        Booking booking = booking(BookingStatus.CONFIRMED);
        LocalDate newDay = DAY.plusDays(3);
        Booking other = booking(BookingStatus.PAID);
        other.setId(2L);
        givenLocked(booking);
        given(settingsService.zoneFor(TENANT)).willReturn(ZoneOffset.UTC);
        given(blackoutRepository.findOverlapping(any(), any(), any(), any(), any())).willReturn(List.of());
        given(bookingRepository.findActiveDateBookings(TENANT, SERVICE_ID, newDay, newDay)).willReturn(List.of(other));

        assertThatThrownBy(() -> ledger.reschedule(TENANT, 1L, TemporalKey.ofDate(newDay)))
                .isInstanceOf(SlotConflictException.class);
        assertThat(booking.getBookingDate()).isEqualTo(DAY);
    }

    @Test
    @DisplayName("expireStaleHolds() skips holds that were paid after the scan")
    void expireStaleHolds_rechecksUnderLock() {
        Booking stale = booking(BookingStatus.PENDING);
        Booking paidMeanwhile = booking(BookingStatus.PAID);
        given(bookingRepository.findByStatusAndCreatedAtBefore(any(), any())).willReturn(List.of(booking(BookingStatus.PENDING)));
        given(bookingRepository.findByIdAndTenantIdForUpdate(1L, TENANT)).willReturn(Optional.of(paidMeanwhile));

        int released = ledger.expireStaleHolds();

        assertThat(released).isZero();
        assertThat(paidMeanwhile.getStatus()).isEqualTo(BookingStatus.PAID);
        assertThat(stale.getStatus()).isEqualTo(BookingStatus.PENDING);
    }

    @Test
    @DisplayName("expireStaleHolds() cancels abandoned holds by SYSTEM")
    void expireStaleHolds_releases() {
        Booking stale = booking(BookingStatus.PENDING);
        given(bookingRepository.findByStatusAndCreatedAtBefore(any(), any())).willReturn(List.of(stale));
        givenLocked(stale);
        givenSaveReturnsArgument();

        int released = ledger.expireStaleHolds();

        assertThat(released).isEqualTo(1);
        assertThat(stale.getStatus()).isEqualTo(BookingStatus.CANCELED);
        assertThat(stale.getCancelledBy()).isEqualTo(CancelledBy.SYSTEM);
    }
}

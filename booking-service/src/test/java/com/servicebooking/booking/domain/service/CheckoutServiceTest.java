package com.servicebooking.booking.domain.service;

import com.servicebooking.booking.api.dto.CheckoutResponse;
import com.servicebooking.booking.api.dto.CreateCheckoutRequest;
import com.servicebooking.booking.client.PaymentGateway;
import com.servicebooking.booking.client.dto.CheckoutSessionRequest;
import com.servicebooking.booking.client.dto.CheckoutSessionResponse;
import com.servicebooking.booking.domain.model.Booking;
import com.servicebooking.booking.domain.model.BookingMode;
import com.servicebooking.booking.domain.model.BookingStatus;
import com.servicebooking.booking.domain.model.ServiceOffering;
import com.servicebooking.booking.domain.model.TemporalKey;
import com.servicebooking.booking.domain.repository.ServiceOfferingRepository;
import com.servicebooking.booking.exception.SlotConflictException;
import com.servicebooking.common.exception.BusinessException;
import com.servicebooking.common.exception.ServiceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CheckoutServiceTest {

    private static final String TENANT = "tenant-a";
    private static final LocalDate DAY = LocalDate.of(2026, 7, 4);

    @Mock
    private IdempotencyGate idempotencyGate;

    @Mock
    private BookingLedger bookingLedger;

    @Mock
    private ServiceOfferingRepository offeringRepository;

    @Mock
    private PaymentGateway paymentGateway;

    @InjectMocks
    private CheckoutService checkoutService;

    private ServiceOffering offering;
    private Booking reserved;

    @BeforeEach
    void setUp() {
        given(idempotencyGate.execute(eq(TENANT), anyString(), eq(CheckoutResponse.class), any()))
                .willAnswer(inv -> ((Supplier<?>) inv.getArgument(3)).get());

        offering = ServiceOffering.builder()
                .id(3L)
                .tenantId(TENANT)
                .name("Venue hire")
                .mode(BookingMode.DATE)
                .price(new BigDecimal("999.99"))
                .depositPercent(30)
                .active(true)
                .build();
        reserved = Booking.builder()
                .id(41L)
                .tenantId(TENANT)
                .serviceId(3L)
                .confirmationCode("QWER7890")
                .customerEmail("sam@example.com")
                .totalAmount(offering.getPrice())
                .status(BookingStatus.PENDING)
                .activeHold(Boolean.TRUE)
                .build();
        reserved.assignTemporalKey(TemporalKey.ofDate(DAY));
    }

    private static CreateCheckoutRequest request(boolean deposit) {
        return new CreateCheckoutRequest(3L, DAY, null, null, "Sam", "sam@example.com", null, deposit);
    }

    @Test
    @DisplayName("checkout reserves the slot, opens a session and attaches it to the booking")
    void createCheckout_success() {
        given(offeringRepository.findByIdAndTenantId(3L, TENANT)).willReturn(Optional.of(offering));
        given(bookingLedger.reserve(eq(TENANT), eq(3L), eq(TemporalKey.ofDate(DAY)), any(), eq(offering.getPrice())))
                .willReturn(reserved);
        given(paymentGateway.createCheckoutSession(any())).willReturn(new CheckoutSessionResponse("cs_1", "https://pay.example/cs_1"));
        given(bookingLedger.attachCheckoutSession(TENANT, 41L, "cs_1", false)).willAnswer(inv -> {
            reserved.setCheckoutSessionId("cs_1");
            return reserved;
        });

        CheckoutResponse response = checkoutService.createCheckout(TENANT, "key-1", request(false));

        assertThat(response.bookingId()).isEqualTo(41L);
        assertThat(response.checkoutUrl()).isEqualTo("https://pay.example/cs_1");
        assertThat(response.checkoutSessionId()).isEqualTo("cs_1");
        assertThat(response.amountDue()).isEqualByComparingTo("999.99");
        assertThat(response.slotKey()).isEqualTo("2026-07-04");

        ArgumentCaptor<CheckoutSessionRequest> session = ArgumentCaptor.forClass(CheckoutSessionRequest.class);
        verify(paymentGateway).createCheckoutSession(session.capture());
        assertThat(session.getValue().idempotencyKey()).isEqualTo("checkout-41");
        assertThat(session.getValue().confirmationCode()).isEqualTo("QWER7890");
    }

    @Test
    @DisplayName("a deposit checkout charges the configured percentage rounded half-up")
    void createCheckout_deposit() {
        given(offeringRepository.findByIdAndTenantId(3L, TENANT)).willReturn(Optional.of(offering));
        given(bookingLedger.reserve(any(), any(), any(), any(), any())).willReturn(reserved);
        given(paymentGateway.createCheckoutSession(any())).willReturn(new CheckoutSessionResponse("cs_2", "https://pay.example/cs_2"));
        given(bookingLedger.attachCheckoutSession(TENANT, 41L, "cs_2", true)).willReturn(reserved);

        CheckoutResponse response = checkoutService.createCheckout(TENANT, "key-2", request(true));

        // 999.99 * 30% = 299.997
        assertThat(response.amountDue()).isEqualByComparingTo("300.00");
        ArgumentCaptor<CheckoutSessionRequest> session = ArgumentCaptor.forClass(CheckoutSessionRequest.class);
        verify(paymentGateway).createCheckoutSession(session.capture());
        assertThat(session.getValue().deposit()).isTrue();
    }

    @Test
    @DisplayName("a deposit is refused when the offering takes none, before anything is reserved")
    void createCheckout_depositNotSupported() {
        offering.setDepositPercent(null);
        given(offeringRepository.findByIdAndTenantId(3L, TENANT)).willReturn(Optional.of(offering));

        assertThatThrownBy(() -> checkoutService.createCheckout(TENANT, "key-3", request(true)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo("DEPOSIT_NOT_SUPPORTED");
        verify(bookingLedger, never()).reserve(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("a provider failure cancels the fresh booking and surfaces as unavailable")
    void createCheckout_providerDown_compensates() {
        given(offeringRepository.findByIdAndTenantId(3L, TENANT)).willReturn(Optional.of(offering));
        given(bookingLedger.reserve(any(), any(), any(), any(), any())).willReturn(reserved);
        given(paymentGateway.createCheckoutSession(any())).willThrow(new IllegalStateException("connect timed out"));

        assertThatThrownBy(() -> checkoutService.createCheckout(TENANT, "key-4", request(false)))
                .isInstanceOf(ServiceUnavailableException.class)
                .hasMessageContaining("slot was released");
        verify(bookingLedger).cancel(TENANT, 41L, Booking.CancelledBy.SYSTEM, "Checkout session could not be created");
        verify(bookingLedger, never()).attachCheckoutSession(any(), any(), any(), anyBoolean());
    }

    @Test
    @DisplayName("a lost slot race propagates without opening a payment session")
    void createCheckout_slotTaken() {
        given(offeringRepository.findByIdAndTenantId(3L, TENANT)).willReturn(Optional.of(offering));
        given(bookingLedger.reserve(any(), any(), any(), any(), any()))
                .willThrow(new SlotConflictException("2026-07-04 is no longer available, please choose another"));

        assertThatThrownBy(() -> checkoutService.createCheckout(TENANT, "key-5", request(false)))
                .isInstanceOf(SlotConflictException.class);
        verify(paymentGateway, never()).createCheckoutSession(any());
    }
}

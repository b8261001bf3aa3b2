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
import com.servicebooking.common.exception.ResourceNotFoundException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Owns booking creation and the booking state machine.
 *
 * Slot exclusivity: at most one booking per (tenant, service, temporal key) holds the slot,
 * enforced by the uk_booking_active_slot and ex_booking_active_range constraints through the configured
 * {@link ReservationStrategy}. The availability pre-checks here only give a fast,
 * friendly answer; the constrained write is what decides a race.
 *
 * Strategy selection uses Spring's Map injection: every ReservationStrategy bean is
 * injected keyed by bean name and {@code booking.reservation.strategy} picks one.
 *
 * Transitions lock the booking row (SELECT ... FOR UPDATE) so that out-of-order or
 * duplicated payment events are evaluated one at a time against the latest status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingLedger {

    private static final String CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    private static final int CODE_LENGTH = 8;
    private static final String DEFAULT_STRATEGY = "constraint";

    private final SecureRandom random = new SecureRandom();

    private final Map<String, ReservationStrategy> reservationStrategies;
    private final BookingRepository bookingRepository;
    private final ServiceOfferingRepository offeringRepository;
    private final BlackoutIntervalRepository blackoutRepository;
    private final TenantCalendarSettingsService settingsService;
    private final PaymentGateway paymentGateway;
    private final ApplicationEventPublisher eventPublisher;
    private final PlatformTransactionManager transactionManager;

    @Value("${booking.reservation.strategy:constraint}")
    private String strategyType;

    @Value("${booking.reservation.pending-hold-ttl-minutes:1440}")
    private long pendingHoldTtlMinutes;

    @PostConstruct
    public void init() {
        ReservationStrategy strategy = getReservationStrategy();
        log.info("Initialized BookingLedger with reservation strategy: {}", strategy.getStrategyType());
    }

    /**
     * Creates a PENDING booking holding {@code key}. The booking exists from the moment
     * checkout is requested, which reserves the slot before payment completes.
     *
     * @throws SlotConflictException if the slot is held by another active booking or blacked out
     */
    @Transactional
    public Booking reserve(String tenantId, Long serviceId, TemporalKey key, CustomerInfo customer, BigDecimal amount) {
        ServiceOffering offering = offeringRepository.findByIdAndTenantId(serviceId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Service offering", serviceId));
        if (!offering.isActive()) {
            throw new BusinessException("Service offering " + serviceId + " is not bookable", "OFFERING_INACTIVE");
        }
        if (offering.getMode() != key.mode()) {
            throw new BusinessException(
                    String.format("Service offering %d is booked by %s, got a %s key", serviceId, offering.getMode(), key.mode()),
                    "INVALID_BOOKING_MODE");
        }
        if (amount == null || amount.signum() < 0) {
            throw new BusinessException("Booking amount must be zero or positive", "INVALID_AMOUNT");
        }

        ensureNotBlackedOut(tenantId, key);
        ensureSlotFree(tenantId, serviceId, key, null);

        Booking candidate = Booking.builder()
                .tenantId(tenantId)
                .serviceId(serviceId)
                .customerName(customer.name())
                .customerEmail(customer.email())
                .customerPhone(customer.phone())
                .totalAmount(amount)
                .status(BookingStatus.PENDING)
                .activeHold(Boolean.TRUE)
                .refundStatus(RefundStatus.NONE)
                .confirmationCode(generateConfirmationCode())
                .build();
        candidate.assignTemporalKey(key);

        Booking booking = getReservationStrategy().claimSlot(candidate);
        log.info("Reserved {} of service {} for tenant {} as booking {} ({})",
                key, serviceId, tenantId, booking.getId(), booking.getConfirmationCode());
        return booking;
    }

    @Transactional
    public Booking advance(String tenantId, Long bookingId, LedgerEvent event) {
        return advance(tenantId, bookingId, event, null, null);
    }

    /**
     * Applies {@code event}. Advancing a terminal booking, or one already in the target status,
     * is a logged no-op so that redelivered events are harmless.
     *
     * @param amount           captured or refunded amount reported with the event, may be null
     * @param paymentReference provider payment reference, may be null
     * @throws InvalidTransitionException if the event is not legal from the current status
     */
    @Transactional
    public Booking advance(String tenantId, Long bookingId, LedgerEvent event, BigDecimal amount, String paymentReference) {
        Booking booking = lockBooking(tenantId, bookingId);
        BookingStatus current = booking.getStatus();
        BookingStatus target = event.targetStatus();

        if (current.isTerminal()) {
            if (event.capturesFunds()) {
                log.warn("Booking {} is {} but received {} (amount {}); funds may need a manual refund",
                        bookingId, current, event, amount);
            } else {
                log.info("Booking {} is already {}, ignoring {}", bookingId, current, event);
            }
            return booking;
        }
        if (current == target) {
            log.info("Booking {} is already {}, ignoring duplicate {}", bookingId, current, event);
            return booking;
        }
        if (!event.isAllowedFrom(current)) {
            log.error("Rejected {} for booking {}: {} -> {} is not a legal transition", event, bookingId, current, target);
            throw new InvalidTransitionException(bookingId, current, target);
        }

        if (event.capturesFunds()) {
            BigDecimal paid = booking.getPaidAmount() == null ? BigDecimal.ZERO : booking.getPaidAmount();
            booking.setPaidAmount(paid.add(capturedAmount(booking, event, amount, paid)));
            booking.setDeposit(event == LedgerEvent.DEPOSIT_CAPTURED || booking.isDeposit());
        }
        if (paymentReference != null) {
            booking.setPaymentReference(paymentReference);
        }

        booking.moveTo(target);
        if (target == BookingStatus.CANCELED) {
            booking.setCancelledBy(CancelledBy.SYSTEM);
            booking.setCancellationReason(event.name());
            booking.setCancelledAt(LocalDateTime.now());
        } else if (target == BookingStatus.REFUNDED) {
            booking.setRefundStatus(RefundStatus.COMPLETED);
            booking.setRefundAmount(amount != null ? amount : booking.getPaidAmount());
            booking.setRefundedAt(LocalDateTime.now());
        }

        Booking saved = bookingRepository.save(booking);
        log.info("Booking {} moved {} -> {} on {}", bookingId, current, target, event);

        if (target == BookingStatus.CONFIRMED) {
            eventPublisher.publishEvent(confirmedEvent(saved));
        } else if (!target.holdsSlot()) {
            eventPublisher.publishEvent(cancelledEvent(saved));
        }
        return saved;
    }

    /**
     * Cancels a non-terminal booking and releases its slot.
     *
     * With captured funds, the cancellation commits first with refund status PENDING; the refund
     * is then requested from the payment collaborator outside any transaction and its outcome is
     * recorded in a second commit. A failed refund is recorded as FAILED and never undoes the
     * cancellation.
     *
     * @throws BookingStateConflictException if the booking is already CANCELED, REFUNDED or FULFILLED
     */
    public Booking cancel(String tenantId, Long bookingId, CancelledBy actor, String reason) {
        Booking cancelled = new TransactionTemplate(transactionManager).execute(status -> {
            Booking booking = lockBooking(tenantId, bookingId);
            if (booking.getStatus().isTerminal()) {
                throw new BookingStateConflictException(bookingId, booking.getStatus());
            }
            BookingStatus previous = booking.getStatus();
            booking.moveTo(BookingStatus.CANCELED);
            booking.setCancelledBy(actor);
            booking.setCancellationReason(reason);
            booking.setCancelledAt(LocalDateTime.now());
            if (booking.hasCapturedFunds()) {
                booking.setRefundStatus(RefundStatus.PENDING);
            }
            Booking saved = bookingRepository.save(booking);
            log.info("Booking {} cancelled by {} (was {}): {}", bookingId, actor, previous, reason);
            eventPublisher.publishEvent(cancelledEvent(saved));
            return saved;
        });

        if (cancelled == null || cancelled.getRefundStatus() != RefundStatus.PENDING) {
            return cancelled;
        }
        return requestRefund(cancelled);
    }

    /**
     * Moves a non-terminal booking to a new temporal key under the same exclusivity guard.
     */
    @Transactional
    public Booking reschedule(String tenantId, Long bookingId, TemporalKey newKey) {
        Booking booking = lockBooking(tenantId, bookingId);
        if (booking.getStatus().isTerminal()) {
            throw new BookingStateConflictException(bookingId, booking.getStatus());
        }
        if (booking.getMode() != newKey.mode()) {
            throw new BusinessException("Cannot reschedule a " + booking.getMode() + " booking to a "
                    + newKey.mode() + " key", "INVALID_BOOKING_MODE");
        }
        if (booking.getSlotKey().equals(newKey.slotKey())) {
            return booking;
        }

        ensureNotBlackedOut(tenantId, newKey);
        ensureSlotFree(tenantId, booking.getServiceId(), newKey, bookingId);

        TemporalKey previous = booking.temporalKey();
        booking.assignTemporalKey(newKey);
        Booking saved = getReservationStrategy().claimSlot(booking);
        log.info("Booking {} rescheduled from {} to {}", bookingId, previous, newKey);
        return saved;
    }

    @Transactional
    public Booking attachCheckoutSession(String tenantId, Long bookingId, String checkoutSessionId, boolean deposit) {
        Booking booking = lockBooking(tenantId, bookingId);
        booking.setCheckoutSessionId(checkoutSessionId);
        booking.setDeposit(deposit);
        return bookingRepository.save(booking);
    }

    @Transactional(readOnly = true)
    public Booking getBooking(String tenantId, Long bookingId) {
        return bookingRepository.findByIdAndTenantId(bookingId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    @Transactional(readOnly = true)
    public List<Booking> listBookings(String tenantId) {
        return bookingRepository.findByTenantIdOrderByCreatedAtDesc(tenantId);
    }

    /**
     * Cancels PENDING bookings whose checkout was never completed within the hold TTL.
     * Returns the number of holds released.
     */
    public int expireStaleHolds() {
        LocalDateTime cutoff = LocalDateTime.now().minusMinutes(pendingHoldTtlMinutes);
        List<Booking> stale = bookingRepository.findByStatusAndCreatedAtBefore(BookingStatus.PENDING, cutoff);
        int released = 0;
        for (Booking booking : stale) {
            try {
                if (expireHold(booking.getTenantId(), booking.getId(), cutoff)) {
                    released++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to release stale hold of booking {}", booking.getId(), e);
            }
        }
        if (released > 0) {
            log.info("Released {} stale pending hold(s) older than {} minutes", released, pendingHoldTtlMinutes);
        }
        return released;
    }

    private boolean expireHold(String tenantId, Long bookingId, LocalDateTime cutoff) {
        Boolean expired = new TransactionTemplate(transactionManager).execute(status -> {
            Booking booking = lockBooking(tenantId, bookingId);
            // re-checked under the row lock: a payment may have landed since the scan
            if (booking.getStatus() != BookingStatus.PENDING || !booking.getCreatedAt().isBefore(cutoff)) {
                return false;
            }
            booking.moveTo(BookingStatus.CANCELED);
            booking.setCancelledBy(CancelledBy.SYSTEM);
            booking.setCancellationReason("Checkout not completed in time");
            booking.setCancelledAt(LocalDateTime.now());
            eventPublisher.publishEvent(cancelledEvent(bookingRepository.save(booking)));
            return true;
        });
        return Boolean.TRUE.equals(expired);
    }

    private Booking requestRefund(Booking booking) {
        RefundRequest request = new RefundRequest(
                booking.getTenantId(),
                booking.getId(),
                booking.getPaymentReference(),
                booking.getPaidAmount(),
                booking.getCancellationReason(),
                "refund-" + booking.getId());

        RefundStatus outcome;
        BigDecimal refunded = null;
        try {
            RefundResponse response = paymentGateway.refund(request);
            if (response.isCompleted()) {
                outcome = RefundStatus.COMPLETED;
                refunded = response.amount() != null ? response.amount() : booking.getPaidAmount();
            } else if (response.isPartial()) {
                outcome = RefundStatus.PARTIAL;
                refunded = response.amount();
            } else if (response.isFailed()) {
                outcome = RefundStatus.FAILED;
            } else {
                outcome = RefundStatus.PROCESSING;
            }
        } catch (RuntimeException e) {
            log.error("Refund request for booking {} failed, recording FAILED for follow-up", booking.getId(), e);
            outcome = RefundStatus.FAILED;
        }
        return recordRefundOutcome(booking.getTenantId(), booking.getId(), outcome, refunded);
    }

    private Booking recordRefundOutcome(String tenantId, Long bookingId, RefundStatus outcome, BigDecimal refunded) {
        return new TransactionTemplate(transactionManager).execute(status -> {
            Booking booking = lockBooking(tenantId, bookingId);
            booking.setRefundStatus(outcome);
            if (refunded != null) {
                booking.setRefundAmount(refunded);
                booking.setRefundedAt(LocalDateTime.now());
            }
            Booking saved = bookingRepository.save(booking);
            log.info("Refund for booking {} recorded as {} (amount {})", bookingId, outcome, refunded);
            return saved;
        });
    }

    private Booking lockBooking(String tenantId, Long bookingId) {
        return bookingRepository.findByIdAndTenantIdForUpdate(bookingId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    private void ensureNotBlackedOut(String tenantId, TemporalKey key) {
        ZoneId zone = settingsService.zoneFor(tenantId);
        Instant from;
        Instant to;
        LocalDate fromDate;
        LocalDate toDate;
        if (key.mode() == BookingMode.DATE) {
            from = key.date().atStartOfDay(zone).toInstant();
            to = key.date().plusDays(1).atStartOfDay(zone).toInstant();
            fromDate = key.date();
            toDate = key.date();
        } else {
            from = key.start();
            to = key.end();
            fromDate = LocalDate.ofInstant(from, zone);
            toDate = LocalDate.ofInstant(to.minusNanos(1), zone);
        }
        for (BlackoutInterval blackout : blackoutRepository.findOverlapping(tenantId, fromDate, toDate, from, to)) {
            if (blackout.toTimeRange(zone).overlaps(from, to)) {
                throw new SlotConflictException(String.format("%s is not available (%s)", key,
                        blackout.getReason() != null ? blackout.getReason() : "blackout"));
            }
        }
    }

    private void ensureSlotFree(String tenantId, Long serviceId, TemporalKey key, Long excludeBookingId) {
        boolean taken;
        if (key.mode() == BookingMode.DATE) {
            taken = excludeBookingId == null
                    ? bookingRepository.existsActiveHold(tenantId, serviceId, key.slotKey())
                    : bookingRepository.findActiveDateBookings(tenantId, serviceId, key.date(), key.date()).stream()
                    .anyMatch(b -> !b.getId().equals(excludeBookingId));
        } else {
            taken = bookingRepository.findActiveSlotBookingsOverlapping(tenantId, serviceId, key.start(), key.end())
                    .stream()
                    .anyMatch(b -> !b.getId().equals(excludeBookingId));
        }
        if (taken) {
            throw new SlotConflictException(String.format("%s is no longer available, please choose another", key));
        }
    }

    private ReservationStrategy getReservationStrategy() {
        ReservationStrategy strategy = reservationStrategies.get(strategyType.toLowerCase());
        if (strategy == null) {
            log.warn("Unknown strategy type: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, reservationStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = reservationStrategies.get(DEFAULT_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " strategy not found. Available strategies: " + reservationStrategies.keySet());
            }
        }
        return strategy;
    }

    private static BigDecimal capturedAmount(Booking booking, LedgerEvent event, BigDecimal reported, BigDecimal paid) {
        if (reported != null) {
            return reported;
        }
        return switch (event) {
            case PAYMENT_CAPTURED -> booking.getTotalAmount();
            case BALANCE_CAPTURED -> booking.getTotalAmount().subtract(paid).max(BigDecimal.ZERO);
            default -> BigDecimal.ZERO;
        };
    }

    private String generateConfirmationCode() {
        StringBuilder code = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            code.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return code.toString();
    }

    private BookingConfirmedEvent confirmedEvent(Booking booking) {
        return BookingConfirmedEvent.builder()
                .bookingId(booking.getId())
                .tenantId(booking.getTenantId())
                .serviceId(booking.getServiceId())
                .confirmationCode(booking.getConfirmationCode())
                .bookingMode(booking.getMode().name())
                .bookingDate(booking.getBookingDate())
                .startsAt(booking.getStartsAt())
                .endsAt(booking.getEndsAt())
                .customerEmail(booking.getCustomerEmail())
                .totalAmount(booking.getTotalAmount())
                .paidAmount(booking.getPaidAmount())
                .timestamp(Instant.now())
                .build();
    }

    private BookingCancelledEvent cancelledEvent(Booking booking) {
        return BookingCancelledEvent.builder()
                .bookingId(booking.getId())
                .tenantId(booking.getTenantId())
                .serviceId(booking.getServiceId())
                .slotKey(booking.getSlotKey())
                .cancelledBy(booking.getCancelledBy() != null ? booking.getCancelledBy().name() : null)
                .reason(booking.getCancellationReason())
                .refundStatus(booking.getRefundStatus().name())
                .refundAmount(booking.getRefundAmount())
                .timestamp(Instant.now())
                .build();
    }
}

package com.servicebooking.booking.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicebooking.booking.domain.model.Decision;
import com.servicebooking.booking.domain.model.NegotiationEvent;
import com.servicebooking.booking.domain.model.NegotiationRequest;
import com.servicebooking.booking.domain.model.RequestStatus;
import com.servicebooking.booking.domain.model.RequestType;
import com.servicebooking.booking.domain.repository.BookingRepository;
import com.servicebooking.booking.domain.repository.NegotiationEventRepository;
import com.servicebooking.booking.domain.repository.NegotiationRequestRepository;
import com.servicebooking.booking.exception.ConcurrentRequestModificationException;
import com.servicebooking.booking.exception.RequestAlreadyResolvedException;
import com.servicebooking.common.exception.BusinessException;
import com.servicebooking.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Customer requests on a booking, decided at most once by the operator.
 *
 * A decision is a compare-and-set on the request's version: the UPDATE only matches a row that
 * is still PENDING, unexpired and at the version the operator looked at. Of two operators
 * deciding the same version concurrently exactly one matches; the other gets
 * {@link ConcurrentRequestModificationException} with the version to re-fetch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConcurrentRequestArbiter {

    private static final String SYSTEM_ACTOR = "system";

    private final NegotiationRequestRepository requestRepository;
    private final NegotiationEventRepository eventRepository;
    private final BookingRepository bookingRepository;
    private final ObjectMapper objectMapper;

    @Value("${booking.negotiation.expiry-hours:72}")
    private long expiryHours;

    @Transactional
    public NegotiationRequest createRequest(String tenantId, Long bookingId, RequestType type,
                                            String payload, String requestedBy) {
        if (bookingRepository.findByIdAndTenantId(bookingId, tenantId).isEmpty()) {
            throw new ResourceNotFoundException("Booking", bookingId);
        }
        NegotiationRequest request = requestRepository.save(NegotiationRequest.builder()
                .tenantId(tenantId)
                .bookingId(bookingId)
                .type(type)
                .payload(payload)
                .requestedBy(requestedBy)
                .status(RequestStatus.PENDING)
                .version(1)
                .expiresAt(LocalDateTime.now().plusHours(expiryHours))
                .build());

        appendEvent(request, NegotiationEvent.Type.REQUEST_SUBMITTED, requestedBy,
                details("type", type, "payload", payload));
        log.info("Request {} ({}) submitted on booking {} of tenant {}", request.getId(), type, bookingId, tenantId);
        return request;
    }

    /**
     * Records {@code decision} if the request is still at {@code expectedVersion}.
     *
     * @throws ConcurrentRequestModificationException if the version moved on; nothing is written
     * @throws RequestAlreadyResolvedException        if the request is no longer PENDING, including
     *                                                one that lapsed and is marked EXPIRED by this call
     */
    @Transactional(noRollbackFor = RequestAlreadyResolvedException.class)
    public NegotiationRequest decide(String tenantId, Long requestId, int expectedVersion,
                                     Decision decision, String note, String decidedBy) {
        if (decision == Decision.DENY && (note == null || note.isBlank())) {
            throw new BusinessException("A reason is required to deny a request", "DENIAL_REASON_REQUIRED");
        }

        LocalDateTime now = LocalDateTime.now();
        int updated = requestRepository.applyDecision(requestId, tenantId, expectedVersion,
                decision.resultingStatus(), decidedBy, note, now);

        NegotiationRequest current = findRequest(tenantId, requestId);
        if (updated == 1) {
            NegotiationEvent.Type type = decision == Decision.APPROVE
                    ? NegotiationEvent.Type.REQUEST_APPROVED
                    : NegotiationEvent.Type.REQUEST_DENIED;
            appendEvent(current, type, decidedBy, details("note", note, "version", current.getVersion()));
            log.info("Request {} {} by {} (version {} -> {})",
                    requestId, current.getStatus(), decidedBy, expectedVersion, current.getVersion());
            return current;
        }

        if (current.getVersion() != expectedVersion) {
            log.warn("Stale decision on request {}: expected version {}, current {}",
                    requestId, expectedVersion, current.getVersion());
            throw new ConcurrentRequestModificationException(requestId, expectedVersion, current.getVersion());
        }
        if (current.getStatus().isResolved()) {
            throw new RequestAlreadyResolvedException(requestId, current.getStatus());
        }
        // same version and still PENDING: only the expiry condition can have failed
        expire(current, now);
        throw new RequestAlreadyResolvedException(requestId, RequestStatus.EXPIRED);
    }

    @Transactional
    public NegotiationRequest getRequest(String tenantId, Long requestId) {
        NegotiationRequest request = findRequest(tenantId, requestId);
        LocalDateTime now = LocalDateTime.now();
        if (request.isLapsed(now) && expire(request, now)) {
            return findRequest(tenantId, requestId);
        }
        return request;
    }

    @Transactional
    public List<NegotiationRequest> listRequests(String tenantId, Long bookingId) {
        List<NegotiationRequest> requests = requestRepository.findByTenantIdAndBookingIdOrderByCreatedAtDesc(tenantId, bookingId);
        LocalDateTime now = LocalDateTime.now();
        boolean changed = false;
        for (NegotiationRequest request : requests) {
            if (request.isLapsed(now)) {
                changed |= expire(request, now);
            }
        }
        return changed
                ? requestRepository.findByTenantIdAndBookingIdOrderByCreatedAtDesc(tenantId, bookingId)
                : requests;
    }

    @Transactional
    public int expireOverdueRequests() {
        LocalDateTime now = LocalDateTime.now();
        int expired = 0;
        for (NegotiationRequest request : requestRepository.findLapsed(now)) {
            if (expire(request, now)) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Expired {} overdue negotiation request(s)", expired);
        }
        return expired;
    }

    @Transactional(readOnly = true)
    public List<NegotiationEvent> getHistory(String tenantId, Long requestId) {
        findRequest(tenantId, requestId);
        return eventRepository.findByRequestIdOrderByCreatedAtAsc(requestId);
    }

    private boolean expire(NegotiationRequest request, LocalDateTime now) {
        if (requestRepository.markExpired(request.getId(), now) == 0) {
            return false;
        }
        appendEvent(request, NegotiationEvent.Type.REQUEST_EXPIRED, SYSTEM_ACTOR,
                details("expiresAt", request.getExpiresAt(), "version", request.getVersion()));
        log.info("Request {} on booking {} expired", request.getId(), request.getBookingId());
        return true;
    }

    private NegotiationRequest findRequest(String tenantId, Long requestId) {
        return requestRepository.findByIdAndTenantId(requestId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Request", requestId));
    }

    private void appendEvent(NegotiationRequest request, NegotiationEvent.Type type, String actor, Map<String, Object> details) {
        eventRepository.save(NegotiationEvent.builder()
                .tenantId(request.getTenantId())
                .requestId(request.getId())
                .type(type)
                .actor(actor)
                .payload(toJson(details))
                .build());
    }

    private static Map<String, Object> details(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(k1, v1 == null ? null : v1.toString());
        details.put(k2, v2 == null ? null : v2.toString());
        return details;
    }

    private String toJson(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize negotiation event payload", e);
        }
    }
}

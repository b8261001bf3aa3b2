package com.servicebooking.booking.api.controller;

import com.servicebooking.booking.api.dto.CreateNegotiationRequest;
import com.servicebooking.booking.api.dto.DecisionRequest;
import com.servicebooking.booking.api.dto.NegotiationEventResponse;
import com.servicebooking.booking.api.dto.NegotiationRequestResponse;
import com.servicebooking.booking.domain.service.ConcurrentRequestArbiter;
import com.servicebooking.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/requests")
@RequiredArgsConstructor
public class NegotiationRequestController {

    private final ConcurrentRequestArbiter requestArbiter;

    @PostMapping
    public ResponseEntity<BaseResponse<NegotiationRequestResponse>> createRequest(
            @PathVariable String tenantId,
            @Valid @RequestBody CreateNegotiationRequest request) {
        NegotiationRequestResponse response = NegotiationRequestResponse.from(requestArbiter.createRequest(
                tenantId, request.bookingId(), request.type(), request.payload(), request.requestedBy()));
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success("Request submitted", response));
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<BaseResponse<NegotiationRequestResponse>> getRequest(
            @PathVariable String tenantId, @PathVariable Long requestId) {
        return ResponseEntity.ok(BaseResponse.success(
                NegotiationRequestResponse.from(requestArbiter.getRequest(tenantId, requestId))));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<NegotiationRequestResponse>>> listRequests(
            @PathVariable String tenantId, @RequestParam Long bookingId) {
        List<NegotiationRequestResponse> response = requestArbiter.listRequests(tenantId, bookingId).stream()
                .map(NegotiationRequestResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{requestId}/decision")
    public ResponseEntity<BaseResponse<NegotiationRequestResponse>> decide(
            @PathVariable String tenantId,
            @PathVariable Long requestId,
            @Valid @RequestBody DecisionRequest request) {
        NegotiationRequestResponse response = NegotiationRequestResponse.from(requestArbiter.decide(
                tenantId, requestId, request.expectedVersion(), request.decision(), request.note(), request.decidedBy()));
        return ResponseEntity.ok(BaseResponse.success("Request " + response.status(), response));
    }

    @GetMapping("/{requestId}/events")
    public ResponseEntity<BaseResponse<List<NegotiationEventResponse>>> getHistory(
            @PathVariable String tenantId, @PathVariable Long requestId) {
        List<NegotiationEventResponse> response = requestArbiter.getHistory(tenantId, requestId).stream()
                .map(NegotiationEventResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(response));
    }
}

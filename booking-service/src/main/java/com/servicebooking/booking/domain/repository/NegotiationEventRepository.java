package com.servicebooking.booking.domain.repository;

import com.servicebooking.booking.domain.model.NegotiationEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface NegotiationEventRepository extends JpaRepository<NegotiationEvent, Long> {

    List<NegotiationEvent> findByRequestIdOrderByCreatedAtAsc(Long requestId);
}

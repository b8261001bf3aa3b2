package com.servicebooking.booking.domain.repository;

import com.servicebooking.booking.domain.model.NegotiationRequest;
import com.servicebooking.booking.domain.model.RequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface NegotiationRequestRepository extends JpaRepository<NegotiationRequest, Long> {

    Optional<NegotiationRequest> findByIdAndTenantId(Long id, String tenantId);

    List<NegotiationRequest> findByTenantIdAndBookingIdOrderByCreatedAtDesc(String tenantId, Long bookingId);

    /**
     * Compare-and-set decision: applies only if the stored version still equals
     * {@code expectedVersion}, the request is PENDING and not past its expiry.
     *
     * Returns the number of rows affected:
     * - 1: decision recorded, version incremented
     * - 0: stale version, already resolved, expired or unknown id (caller reloads to tell which)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE NegotiationRequest r
           SET r.status = :status,
               r.version = r.version + 1,
               r.decidedBy = :decidedBy,
               r.decisionNote = :note,
               r.decidedAt = :now,
               r.updatedAt = :now
           WHERE r.id = :id
             AND r.tenantId = :tenantId
             AND r.version = :expectedVersion
             AND r.status = com.servicebooking.booking.domain.model.RequestStatus.PENDING
             AND r.expiresAt > :now
           """)
    int applyDecision(@Param("id") Long id,
                      @Param("tenantId") String tenantId,
                      @Param("expectedVersion") int expectedVersion,
                      @Param("status") RequestStatus status,
                      @Param("decidedBy") String decidedBy,
                      @Param("note") String note,
                      @Param("now") LocalDateTime now);

    /**
     * Marks a lapsed PENDING request EXPIRED. The version is left alone: expiry is not a decision.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE NegotiationRequest r
           SET r.status = com.servicebooking.booking.domain.model.RequestStatus.EXPIRED,
               r.updatedAt = :now
           WHERE r.id = :id
             AND r.status = com.servicebooking.booking.domain.model.RequestStatus.PENDING
             AND r.expiresAt <= :now
           """)
    int markExpired(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Query("""
           SELECT r FROM NegotiationRequest r
           WHERE r.status = com.servicebooking.booking.domain.model.RequestStatus.PENDING
             AND r.expiresAt <= :now
           """)
    List<NegotiationRequest> findLapsed(@Param("now") LocalDateTime now);
}

package com.servicebooking.booking.domain.repository;

import com.servicebooking.booking.domain.model.IdempotencyRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Optional;

public interface IdempotencyRecordRepository extends JpaRepository<IdempotencyRecord, Long> {

    Optional<IdempotencyRecord> findByTenantIdAndIdempotencyKey(String tenantId, String idempotencyKey);

    /**
     * Stores the result on the caller's own claim. Returns 0 if the claim was purged meanwhile.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE IdempotencyRecord r
           SET r.status = :completed,
               r.responseJson = :responseJson
           WHERE r.id = :id
             AND r.status = :inProgress
           """)
    int complete(@Param("id") Long id,
                 @Param("responseJson") String responseJson,
                 @Param("completed") IdempotencyRecord.Status completed,
                 @Param("inProgress") IdempotencyRecord.Status inProgress);

    default int complete(Long id, String responseJson) {
        return complete(id, responseJson, IdempotencyRecord.Status.COMPLETED, IdempotencyRecord.Status.IN_PROGRESS);
    }

    /**
     * Deletes an IN_PROGRESS claim so the key can be retried after a failed operation.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           DELETE FROM IdempotencyRecord r
           WHERE r.id = :id
             AND r.status = :inProgress
           """)
    int releaseClaim(@Param("id") Long id, @Param("inProgress") IdempotencyRecord.Status inProgress);

    default int releaseClaim(Long id) {
        return releaseClaim(id, IdempotencyRecord.Status.IN_PROGRESS);
    }

    /**
     * Deletes one expired record. Guarded on expiry so a fresh claim that replaced it survives.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM IdempotencyRecord r WHERE r.id = :id AND r.expiresAt <= :now")
    int deleteIfExpired(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Modifying
    @Query("DELETE FROM IdempotencyRecord r WHERE r.expiresAt <= :now")
    int deleteAllExpired(@Param("now") LocalDateTime now);
}

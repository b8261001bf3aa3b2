package com.servicebooking.booking.domain.repository;

import com.servicebooking.booking.domain.model.BlackoutInterval;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public interface BlackoutIntervalRepository extends JpaRepository<BlackoutInterval, Long> {

    /**
     * Whole-day blackouts dated within [fromDate, toDate] plus explicit intervals overlapping [from, to).
     * The caller supplies both forms of the same range, already converted in the tenant's zone.
     */
    @Query("""
           SELECT b FROM BlackoutInterval b
           WHERE b.tenantId = :tenantId
             AND ((b.blackoutDate BETWEEN :fromDate AND :toDate)
                  OR (b.startsAt < :to AND b.endsAt > :from))
           """)
    List<BlackoutInterval> findOverlapping(@Param("tenantId") String tenantId,
                                           @Param("fromDate") LocalDate fromDate,
                                           @Param("toDate") LocalDate toDate,
                                           @Param("from") Instant from,
                                           @Param("to") Instant to);
}

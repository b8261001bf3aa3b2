package com.servicebooking.booking.domain.repository;

import com.servicebooking.booking.domain.model.AvailabilityRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.DayOfWeek;
import java.util.List;

public interface AvailabilityRuleRepository extends JpaRepository<AvailabilityRule, Long> {

    /**
     * Rules scoped to the service plus tenant-wide rules (null service id) for one weekday.
     */
    @Query("""
           SELECT r FROM AvailabilityRule r
           WHERE r.tenantId = :tenantId
             AND r.dayOfWeek = :dayOfWeek
             AND (r.serviceId = :serviceId OR r.serviceId IS NULL)
           ORDER BY r.startTime
           """)
    List<AvailabilityRule> findApplicable(@Param("tenantId") String tenantId,
                                          @Param("serviceId") Long serviceId,
                                          @Param("dayOfWeek") DayOfWeek dayOfWeek);
}

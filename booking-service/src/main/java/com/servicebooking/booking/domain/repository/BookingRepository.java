package com.servicebooking.booking.domain.repository;

import com.servicebooking.booking.domain.model.Booking;
import com.servicebooking.booking.domain.model.BookingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    Optional<Booking> findByIdAndTenantId(Long id, String tenantId);

    List<Booking> findByTenantIdOrderByCreatedAtDesc(String tenantId);

    /**
     * Row lock for state transitions: concurrent webhook deliveries and cancellations
     * on the same booking apply one after the other against fresh state.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id AND b.tenantId = :tenantId")
    Optional<Booking> findByIdAndTenantIdForUpdate(@Param("id") Long id, @Param("tenantId") String tenantId);

    /**
     * Fast pre-check only. The constraints uk_booking_active_slot and ex_booking_active_range decide the race.
     */
    @Query("""
           SELECT COUNT(b) > 0 FROM Booking b
           WHERE b.tenantId = :tenantId
             AND b.serviceId = :serviceId
             AND b.slotKey = :slotKey
             AND b.activeHold = true
           """)
    boolean existsActiveHold(@Param("tenantId") String tenantId,
                             @Param("serviceId") Long serviceId,
                             @Param("slotKey") String slotKey);

    @Query("""
           SELECT b FROM Booking b
           WHERE b.tenantId = :tenantId
             AND b.serviceId = :serviceId
             AND b.activeHold = true
             AND b.bookingDate BETWEEN :from AND :to
           """)
    List<Booking> findActiveDateBookings(@Param("tenantId") String tenantId,
                                         @Param("serviceId") Long serviceId,
                                         @Param("from") LocalDate from,
                                         @Param("to") LocalDate to);

    /**
     * Active TIMESLOT bookings whose [startsAt, endsAt) overlaps [start, end).
     */
    @Query("""
           SELECT b FROM Booking b
           WHERE b.tenantId = :tenantId
             AND b.serviceId = :serviceId
             AND b.activeHold = true
             AND b.startsAt < :end
             AND b.endsAt > :start
           ORDER BY b.startsAt
           """)
    List<Booking> findActiveSlotBookingsOverlapping(@Param("tenantId") String tenantId,
                                                    @Param("serviceId") Long serviceId,
                                                    @Param("start") Instant start,
                                                    @Param("end") Instant end);

    List<Booking> findByStatusAndCreatedAtBefore(BookingStatus status, LocalDateTime before);
}

package com.servicebooking.booking.domain.strategy;

import com.servicebooking.booking.domain.model.Booking;
import com.servicebooking.common.exception.ServiceUnavailableException;
import com.servicebooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Serializes claims for one slot across instances with a Redisson lock, then writes through
 * {@link ConstraintReservationStrategy}.
 *
 * The lock cuts down on unique-violation round-trips under heavy contention for the same
 * slot. It is never the source of truth: if Redis loses the lock, the constraint still
 * rejects the second writer.
 */
@Slf4j
@Component("distributed")
@RequiredArgsConstructor
public class DistributedLockReservationStrategy implements ReservationStrategy {

    private final RedissonClient redissonClient;
    private final ConstraintReservationStrategy constraintStrategy;

    @Override
    public Booking claimSlot(Booking booking) {
        String lockKey = buildLockKey(booking);
        RLock lock = redissonClient.getLock(lockKey);

        try {
            // wait at most 2 seconds, lease 10 seconds
            boolean acquired = lock.tryLock(2, 10, TimeUnit.SECONDS);
            if (!acquired) {
                throw new ServiceUnavailableException("Slot is being reserved by another request. Please try again.");
            }

            log.debug("Acquired distributed lock: {}", lockKey);
            return constraintStrategy.claimSlot(booking);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Reservation interrupted", e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }

    private String buildLockKey(Booking booking) {
        return Constants.LOCK_SLOT_PREFIX + booking.getTenantId() + ":" + booking.getServiceId() + ":" + booking.getSlotKey();
    }
}

package com.unievents.event.domain.strategy;

import com.unievents.common.exception.BusinessException;
import com.unievents.common.exception.ConflictException;
import com.unievents.common.util.Constants;
import com.unievents.event.domain.exception.EventErrorCodes;
import com.unievents.event.domain.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Capacity strategy using a distributed lock (Redis/Redisson) + the guarded UPDATE.
 *
 * The lock queues registrations for the same event across service instances so hot events
 * do not pile up on the database row lock. The guarded UPDATE still decides the outcome:
 * availability is never derived from in-memory entity state.
 */
@Slf4j
@Component("distributed")
@RequiredArgsConstructor
public class DistributedLockCapacityStrategy implements CapacityStrategy {

    private final EventRepository repository;
    private final RedissonClient redissonClient;

    @Value("${events.registration.lock.wait-seconds:5}")
    private long waitSeconds = 5;

    @Value("${events.registration.lock.lease-seconds:30}")
    private long leaseSeconds = 30;

    @Override
    @Transactional
    public void acquireSeat(UUID eventId) {
        String lockKey = Constants.LOCK_PREFIX + eventId;
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(waitSeconds, leaseSeconds, TimeUnit.SECONDS);
            if (!acquired) {
                throw new ConflictException(
                        "Registration is busy for this event. Please try again.",
                        EventErrorCodes.CAPACITY_LOCK_UNAVAILABLE);
            }

            log.debug("Acquired distributed lock: {}", lockKey);
            int updatedRows = repository.incrementRegisteredCountIfAvailable(eventId);
            if (updatedRows == 0) {
                throw new ConflictException(
                        String.format("Event %s is at full capacity", eventId),
                        EventErrorCodes.EVENT_FULL);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException("Registration interrupted", e, "REGISTRATION_INTERRUPTED");
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
}

package com.unievents.event.domain.strategy;

import com.unievents.common.exception.ConflictException;
import com.unievents.common.exception.ResourceNotFoundException;
import com.unievents.event.domain.exception.EventErrorCodes;
import com.unievents.event.domain.model.Event;
import com.unievents.event.domain.repository.EventRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Capacity strategy using a pessimistic lock (SELECT FOR UPDATE).
 *
 * Flow:
 * 1. Re-read the event row with an exclusive lock (refresh, so a copy cached earlier in the
 *    transaction cannot hide a newer count)
 * 2. Check capacity
 * 3. Increment and flush
 * 4. Commit releases the lock
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockCapacityStrategy implements CapacityStrategy {

    private final EventRepository repository;
    private final EntityManager entityManager;

    @Override
    @Transactional
    public void acquireSeat(UUID eventId) {
        Event event = repository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
        entityManager.refresh(event, LockModeType.PESSIMISTIC_WRITE);

        if (event.isFull()) {
            throw new ConflictException(
                    String.format("Event %s is at full capacity", eventId),
                    EventErrorCodes.EVENT_FULL);
        }

        event.incrementRegisteredCount();
        repository.saveAndFlush(event);
        log.debug("Seat taken on event {} (pessimistic lock), count now {}", eventId, event.getRegisteredCount());
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}

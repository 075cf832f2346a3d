package com.unievents.event.domain.strategy;

import com.unievents.common.exception.ConflictException;
import com.unievents.common.exception.ResourceNotFoundException;
import com.unievents.event.domain.exception.EventErrorCodes;
import com.unievents.event.domain.model.Event;
import com.unievents.event.domain.repository.EventRepository;
import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Capacity strategy using the event's version column.
 *
 * Flow:
 * 1. Read the current count and version
 * 2. Reject if full
 * 3. UPDATE ... WHERE version = :version (bumps the version)
 * 4. 0 rows means another writer got in between: retry once, then report EVENT_FULL
 *
 * The lost race is signalled with OptimisticLockingFailureException inside the retry template
 * only; it never crosses a transactional proxy, so the surrounding transaction stays usable.
 */
@Slf4j
@Component("optimistic")
public class OptimisticLockCapacityStrategy implements CapacityStrategy {

    static final int MAX_ATTEMPTS = 2;

    private final EventRepository repository;
    private final EntityManager entityManager;
    private final RetryTemplate retryTemplate;

    public OptimisticLockCapacityStrategy(EventRepository repository, EntityManager entityManager) {
        this.repository = repository;
        this.entityManager = entityManager;
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(MAX_ATTEMPTS)
                .fixedBackoff(50)
                .retryOn(OptimisticLockingFailureException.class)
                .build();
    }

    @Override
    @Transactional
    public void acquireSeat(UUID eventId) {
        retryTemplate.execute(
                context -> {
                    tryIncrement(eventId, context.getRetryCount());
                    return null;
                },
                context -> {
                    Throwable last = context.getLastThrowable();
                    if (last instanceof RuntimeException && !(last instanceof OptimisticLockingFailureException)) {
                        throw (RuntimeException) last;
                    }
                    log.info("Lost capacity race on event {} after {} attempts", eventId, context.getRetryCount());
                    throw new ConflictException(
                            String.format("Event %s is at full capacity", eventId),
                            EventErrorCodes.EVENT_FULL);
                });
    }

    private void tryIncrement(UUID eventId, int attempt) {
        Event event = repository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
        entityManager.refresh(event);

        if (event.isFull()) {
            throw new ConflictException(
                    String.format("Event %s is at full capacity", eventId),
                    EventErrorCodes.EVENT_FULL);
        }

        int updatedRows = repository.incrementRegisteredCountIfVersionMatches(eventId, event.getVersion());
        if (updatedRows == 0) {
            log.debug("Version conflict on event {} (attempt {})", eventId, attempt + 1);
            throw new OptimisticLockingFailureException("Event " + eventId + " changed concurrently");
        }
    }

    @Override
    public String getStrategyType() {
        return "OPTIMISTIC_LOCK";
    }
}

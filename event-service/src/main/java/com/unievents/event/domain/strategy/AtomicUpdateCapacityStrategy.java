package com.unievents.event.domain.strategy;

import com.unievents.common.exception.ConflictException;
import com.unievents.event.domain.exception.EventErrorCodes;
import com.unievents.event.domain.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Default strategy: one guarded UPDATE.
 *
 *   UPDATE events
 *   SET registered_count = registered_count + 1
 *   WHERE id = :eventId
 *     AND (capacity IS NULL OR registered_count < capacity);
 *
 * The row lock taken by the UPDATE serializes racing registrations; the loser re-evaluates the
 * WHERE clause against the committed count and affects 0 rows.
 */
@Slf4j
@Component("atomic")
@RequiredArgsConstructor
public class AtomicUpdateCapacityStrategy implements CapacityStrategy {

    private final EventRepository repository;

    @Override
    @Transactional
    public void acquireSeat(UUID eventId) {
        int updatedRows = repository.incrementRegisteredCountIfAvailable(eventId);
        if (updatedRows == 0) {
            throw new ConflictException(
                    String.format("Event %s is at full capacity", eventId),
                    EventErrorCodes.EVENT_FULL);
        }
        log.debug("Seat taken on event {} (atomic update)", eventId);
    }

    @Override
    public String getStrategyType() {
        return "ATOMIC_UPDATE";
    }
}

package com.unievents.event.domain.strategy;

import java.util.UUID;

/**
 * Strategy interface for taking one seat of an event under concurrency.
 *
 * Implementations (bean names):
 * - atomic: single guarded UPDATE
 * - distributed: Redisson lock per event around the guarded UPDATE
 * - pessimistic: SELECT FOR UPDATE, check, increment
 * - optimistic: version-checked UPDATE, one retry on a lost race
 *
 * All of them keep 0 ≤ registeredCount ≤ capacity in the database itself, so several service
 * instances can run side by side.
 */
public interface CapacityStrategy {

    /**
     * Takes one seat or fails with errorCode EVENT_FULL. Must run inside the caller's transaction
     * so that a later failure in the same registration rolls the seat back.
     *
     * @param eventId event to take a seat from
     */
    void acquireSeat(UUID eventId);

    /**
     * @return Strategy type (ATOMIC_UPDATE, DISTRIBUTED_LOCK, PESSIMISTIC_LOCK, OPTIMISTIC_LOCK)
     */
    String getStrategyType();
}

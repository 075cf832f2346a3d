package com.unievents.event.domain.repository;

import com.unievents.event.domain.model.Event;
import com.unievents.event.domain.model.EventStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for Event entity.
 * The registered-count mutations are guarded single-statement UPDATEs: the WHERE clause is the
 * capacity check, so two transactions racing for the last seat cannot both succeed.
 */
public interface EventRepository extends JpaRepository<Event, UUID> {

    /**
     * Takes one seat if the event has no capacity or is below it.
     *
     * Returns the number of rows affected:
     * - 1: seat taken
     * - 0: event full (or missing)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Event e
           SET e.registeredCount = e.registeredCount + 1
           WHERE e.id = :eventId
             AND (e.capacity IS NULL OR e.registeredCount < e.capacity)
           """)
    int incrementRegisteredCountIfAvailable(@Param("eventId") UUID eventId);

    /**
     * Same guard as {@link #incrementRegisteredCountIfAvailable(UUID)} plus a version check.
     * Bumps the version so a concurrent writer holding the old version loses.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Event e
           SET e.registeredCount = e.registeredCount + 1,
               e.version = e.version + 1
           WHERE e.id = :eventId
             AND e.version = :version
             AND (e.capacity IS NULL OR e.registeredCount < e.capacity)
           """)
    int incrementRegisteredCountIfVersionMatches(@Param("eventId") UUID eventId,
                                                 @Param("version") Long version);

    /**
     * Gives one seat back. Never goes below zero.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Event e
           SET e.registeredCount = e.registeredCount - 1
           WHERE e.id = :eventId
             AND e.registeredCount > 0
           """)
    int decrementRegisteredCount(@Param("eventId") UUID eventId);

    List<Event> findByStatusAndArchivedFalseAndEndDateBefore(EventStatus status, Instant before);

    List<Event> findByStatusAndEndDateGreaterThanEqualOrderByEndDateAsc(EventStatus status, Instant since);
}

package com.unievents.event.domain.repository;

import com.unievents.event.domain.model.DueReminder;
import com.unievents.event.domain.model.EventStatus;
import com.unievents.event.domain.model.Registration;
import com.unievents.event.domain.model.RegistrationStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface RegistrationRepository extends JpaRepository<Registration, UUID> {

    /**
     * Row-locked read (SELECT FOR UPDATE). Cancel and payment callbacks go through here so two
     * concurrent cancels serialize and only the first one sees an active registration.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Registration r WHERE r.id = :id")
    Optional<Registration> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByEventIdAndUserIdAndStatusNot(UUID eventId, UUID userId, RegistrationStatus status);

    List<Registration> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<Registration> findByEventIdOrderByCreatedAtAsc(UUID eventId);

    @Query("""
           SELECT new com.unievents.event.domain.model.DueReminder(r, e.name, e.startDate)
           FROM Registration r, Event e
           WHERE r.eventId = e.id
             AND e.status = :eventStatus
             AND e.archived = false
             AND e.startDate >= :from
             AND e.startDate <= :to
             AND r.status <> :excluded
           ORDER BY e.startDate ASC
           """)
    List<DueReminder> findDueReminders(@Param("eventStatus") EventStatus eventStatus,
                                       @Param("from") Instant from,
                                       @Param("to") Instant to,
                                       @Param("excluded") RegistrationStatus excluded);

    @Query("""
           SELECT r FROM Registration r
           WHERE r.eventId = :eventId
             AND r.attended = true
             AND r.certificateIssued = false
             AND r.status <> :excluded
           ORDER BY r.createdAt ASC
           """)
    List<Registration> findCertificateCandidates(@Param("eventId") UUID eventId,
                                                 @Param("excluded") RegistrationStatus excluded);

    /**
     * Sets the certificate flag once. Returns 0 when it was already set (or the row is missing).
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Registration r
           SET r.certificateIssued = true,
               r.certificateIssuedAt = :issuedAt,
               r.updatedAt = :issuedAt
           WHERE r.id = :id
             AND r.certificateIssued = false
           """)
    int markCertificateIssued(@Param("id") UUID id, @Param("issuedAt") Instant issuedAt);
}

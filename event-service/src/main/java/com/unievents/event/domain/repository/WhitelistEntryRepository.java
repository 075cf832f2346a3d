package com.unievents.event.domain.repository;

import com.unievents.event.domain.model.UserRole;
import com.unievents.event.domain.model.WhitelistEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WhitelistEntryRepository extends JpaRepository<WhitelistEntry, UUID> {

    boolean existsByEventIdAndUserId(UUID eventId, UUID userId);

    boolean existsByEventIdAndRole(UUID eventId, UserRole role);

    Optional<WhitelistEntry> findByEventIdAndUserId(UUID eventId, UUID userId);

    Optional<WhitelistEntry> findByEventIdAndRole(UUID eventId, UserRole role);

    List<WhitelistEntry> findByEventIdOrderByCreatedAtAsc(UUID eventId);
}

package com.unievents.event.domain.service;

import com.unievents.common.exception.ForbiddenException;
import com.unievents.common.exception.ResourceNotFoundException;
import com.unievents.event.api.dto.AccessCheckResponse;
import com.unievents.event.api.dto.WhitelistEntryResponse;
import com.unievents.event.domain.access.AccessControlResolver;
import com.unievents.event.domain.model.Actor;
import com.unievents.event.domain.model.Event;
import com.unievents.event.domain.model.UserAccount;
import com.unievents.event.domain.model.UserRole;
import com.unievents.event.domain.model.WhitelistEntry;
import com.unievents.event.domain.repository.EventRepository;
import com.unievents.event.domain.repository.UserAccountRepository;
import com.unievents.event.domain.repository.WhitelistEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Manages additive access grants on restricted events.
 * Removing a grant only affects later access checks; existing registrations stay untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WhitelistService {

    private final WhitelistEntryRepository whitelistEntryRepository;
    private final EventRepository eventRepository;
    private final UserAccountRepository userAccountRepository;
    private final AccessControlResolver accessControlResolver;

    @Transactional
    public WhitelistEntryResponse whitelistUser(UUID eventId, UUID userId, Actor actor) {
        requireEventOffice(actor);
        findEvent(eventId);
        if (!userAccountRepository.existsById(userId)) {
            throw new ResourceNotFoundException("User", userId);
        }
        WhitelistEntry entry = whitelistEntryRepository.findByEventIdAndUserId(eventId, userId)
                .orElseGet(() -> {
                    log.info("Whitelisting user {} on event {}", userId, eventId);
                    return whitelistEntryRepository.save(WhitelistEntry.forUser(eventId, userId, actor.userId()));
                });
        return WhitelistEntryResponse.from(entry);
    }

    @Transactional
    public void removeWhitelistUser(UUID eventId, UUID userId, Actor actor) {
        requireEventOffice(actor);
        WhitelistEntry entry = whitelistEntryRepository.findByEventIdAndUserId(eventId, userId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        String.format("User %s is not whitelisted on event %s", userId, eventId)));
        whitelistEntryRepository.delete(entry);
        log.info("Removed user {} from whitelist of event {}", userId, eventId);
    }

    @Transactional
    public WhitelistEntryResponse whitelistRole(UUID eventId, UserRole role, Actor actor) {
        requireEventOffice(actor);
        findEvent(eventId);
        WhitelistEntry entry = whitelistEntryRepository.findByEventIdAndRole(eventId, role)
                .orElseGet(() -> {
                    log.info("Whitelisting role {} on event {}", role, eventId);
                    return whitelistEntryRepository.save(WhitelistEntry.forRole(eventId, role, actor.userId()));
                });
        return WhitelistEntryResponse.from(entry);
    }

    @Transactional
    public void removeWhitelistRole(UUID eventId, UserRole role, Actor actor) {
        requireEventOffice(actor);
        WhitelistEntry entry = whitelistEntryRepository.findByEventIdAndRole(eventId, role)
                .orElseThrow(() -> new ResourceNotFoundException(
                        String.format("Role %s is not whitelisted on event %s", role, eventId)));
        whitelistEntryRepository.delete(entry);
        log.info("Removed role {} from whitelist of event {}", role, eventId);
    }

    @Transactional(readOnly = true)
    public List<WhitelistEntryResponse> listWhitelist(UUID eventId, Actor actor) {
        requireEventOffice(actor);
        findEvent(eventId);
        return whitelistEntryRepository.findByEventIdOrderByCreatedAtAsc(eventId).stream()
                .map(WhitelistEntryResponse::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public AccessCheckResponse checkAccess(UUID eventId, UUID userId) {
        Event event = findEvent(eventId);
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
        return AccessCheckResponse.of(eventId, userId, accessControlResolver.evaluate(event, user));
    }

    private Event findEvent(UUID eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
    }

    private void requireEventOffice(Actor actor) {
        if (!actor.isEventOffice()) {
            throw new ForbiddenException("Only Event Office or Admin may manage whitelists");
        }
    }
}

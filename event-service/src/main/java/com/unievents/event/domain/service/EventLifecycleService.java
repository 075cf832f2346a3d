package com.unievents.event.domain.service;

import com.unievents.common.exception.BusinessException;
import com.unievents.common.exception.ConflictException;
import com.unievents.common.exception.ForbiddenException;
import com.unievents.common.exception.ResourceNotFoundException;
import com.unievents.event.api.dto.EventRequest;
import com.unievents.event.api.dto.EventResponse;
import com.unievents.event.api.dto.TransitionRequest;
import com.unievents.event.domain.exception.EventErrorCodes;
import com.unievents.event.domain.lifecycle.EventCreationPolicy;
import com.unievents.event.domain.lifecycle.EventLifecycleStateMachine;
import com.unievents.event.domain.model.Actor;
import com.unievents.event.domain.model.Event;
import com.unievents.event.domain.model.EventStatus;
import com.unievents.event.domain.repository.EventRepository;
import com.unievents.event.events.EventStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.HashSet;
import java.util.UUID;

/**
 * Creates, edits and moves events through their lifecycle.
 *
 * Status changes go through {@link EventLifecycleStateMachine}; saves are flushed immediately so a
 * concurrent transition on the same event (detected by the version column) surfaces as
 * CONCURRENT_MODIFICATION instead of silently overwriting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventLifecycleService {

    private final EventRepository eventRepository;
    private final EventLifecycleStateMachine stateMachine;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public EventResponse submitEvent(EventRequest request, Actor actor) {
        if (!EventCreationPolicy.mayCreate(actor, request.type())) {
            throw new ForbiddenException(
                    String.format("Caller may not create %s events", request.type()));
        }
        validate(request);

        Event event = Event.builder()
                .name(request.name())
                .description(request.description())
                .type(request.type())
                .status(EventStatus.DRAFT)
                .location(request.location())
                .startDate(request.startDate())
                .endDate(request.endDate())
                .capacity(request.capacity())
                .registrationDeadline(request.registrationDeadline())
                .price(request.price() == null ? 0L : request.price())
                .restrictedTo(request.restrictedTo() == null ? new HashSet<>() : new HashSet<>(request.restrictedTo()))
                .payload(request.payload())
                .createdBy(actor.userId())
                .build();

        event = eventRepository.saveAndFlush(event);
        log.info("Event {} ({}) created as DRAFT by {}", event.getId(), event.getType(), actor.userId());

        if (request.submitForReview()) {
            stateMachine.transition(event, EventStatus.PENDING_APPROVAL, actor, null);
            event = save(event);
            publishStatusChanged(event, EventStatus.DRAFT.name(), EventStatus.PENDING_APPROVAL.name(), actor, null);
        }
        return EventResponse.from(event);
    }

    @Transactional
    public EventResponse updateEvent(UUID eventId, EventRequest request, Actor actor) {
        Event event = findEvent(eventId);
        if (!stateMachine.isEditable(event, actor)) {
            throw new ForbiddenException(String.format("Event %s is not editable by the caller", eventId));
        }
        if (request.type() != event.getType()) {
            throw new BusinessException("Event type cannot be changed", EventErrorCodes.VALIDATION_ERROR);
        }
        validate(request);
        if (request.capacity() != null && request.capacity() < event.getRegisteredCount()) {
            throw new BusinessException(
                    String.format("Capacity %d is below the %d seats already taken",
                            request.capacity(), event.getRegisteredCount()),
                    EventErrorCodes.VALIDATION_ERROR);
        }

        event.setName(request.name());
        event.setDescription(request.description());
        event.setLocation(request.location());
        event.setStartDate(request.startDate());
        event.setEndDate(request.endDate());
        event.setCapacity(request.capacity());
        event.setRegistrationDeadline(request.registrationDeadline());
        event.setPrice(request.price() == null ? 0L : request.price());
        event.getRestrictedTo().clear();
        if (request.restrictedTo() != null) {
            event.getRestrictedTo().addAll(request.restrictedTo());
        }
        event.setPayload(request.payload());

        event = save(event);
        log.info("Event {} updated by {}", eventId, actor.userId());
        return EventResponse.from(event);
    }

    @Transactional
    public EventResponse transitionEvent(UUID eventId, TransitionRequest request, Actor actor) {
        Event event = findEvent(eventId);
        EventStatus from = event.getStatus();
        boolean wasArchived = event.isArchived();

        stateMachine.transition(event, request.targetStatus(), actor, request.reason());

        if (request.targetStatus() == EventStatus.ARCHIVED) {
            if (wasArchived) {
                return EventResponse.from(event);
            }
            event = save(event);
            publishStatusChanged(event, from.name(), EventStatus.ARCHIVED.name(), actor, null);
            log.info("Event {} archived", eventId);
            return EventResponse.from(event);
        }

        event = save(event);
        publishStatusChanged(event, from.name(), event.getStatus().name(), actor, event.getRejectionReason());
        log.info("Event {} moved {} -> {}", eventId, from, event.getStatus());
        return EventResponse.from(event);
    }

    @Transactional
    public EventResponse unarchiveEvent(UUID eventId, Actor actor) {
        Event event = findEvent(eventId);
        if (stateMachine.unarchive(event, actor)) {
            event = save(event);
            publishStatusChanged(event, EventStatus.ARCHIVED.name(), event.getStatus().name(), actor, null);
            log.info("Event {} unarchived", eventId);
        }
        return EventResponse.from(event);
    }

    /**
     * Moves one ended PUBLISHED event to COMPLETED as the system actor.
     * Returns false when the event is no longer eligible (already moved by someone else).
     */
    @Transactional
    public boolean completeEndedEvent(UUID eventId) {
        Event event = findEvent(eventId);
        if (event.getStatus() != EventStatus.PUBLISHED || event.isArchived()
                || !event.getEndDate().isBefore(clock.instant())) {
            return false;
        }
        stateMachine.transition(event, EventStatus.COMPLETED, Actor.systemActor(), null);
        save(event);
        publishStatusChanged(event, EventStatus.PUBLISHED.name(), EventStatus.COMPLETED.name(), Actor.systemActor(), null);
        return true;
    }

    @Transactional(readOnly = true)
    public EventResponse getEvent(UUID eventId) {
        return EventResponse.from(findEvent(eventId));
    }

    private Event findEvent(UUID eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
    }

    private Event save(Event event) {
        try {
            return eventRepository.saveAndFlush(event);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new ConflictException(
                    String.format("Event %s was modified concurrently, reload and retry", event.getId()),
                    e, EventErrorCodes.CONCURRENT_MODIFICATION);
        } catch (DataIntegrityViolationException e) {
            // registrations taken meanwhile no longer fit the new capacity
            throw new ConflictException(
                    String.format("Event %s no longer satisfies its constraints, reload and retry", event.getId()),
                    e, EventErrorCodes.CONCURRENT_MODIFICATION);
        }
    }

    private void validate(EventRequest request) {
        if (!request.startDate().isBefore(request.endDate())) {
            throw new BusinessException("Start date must be before end date", EventErrorCodes.VALIDATION_ERROR);
        }
        if (request.registrationDeadline() != null && request.registrationDeadline().isAfter(request.endDate())) {
            throw new BusinessException("Registration deadline must not be after the end date",
                    EventErrorCodes.VALIDATION_ERROR);
        }
        if (request.price() != null && request.price() < 0) {
            throw new BusinessException("Price cannot be negative", EventErrorCodes.VALIDATION_ERROR);
        }
        if (request.capacity() != null && request.capacity() <= 0) {
            throw new BusinessException("Capacity must be positive", EventErrorCodes.VALIDATION_ERROR);
        }
        if (request.payload() != null && request.payload().eventType() != request.type()) {
            throw new BusinessException(
                    String.format("Payload of kind %s does not match event type %s",
                            request.payload().eventType(), request.type()),
                    EventErrorCodes.VALIDATION_ERROR);
        }
    }

    private void publishStatusChanged(Event event, String from, String to, Actor actor, String reason) {
        eventPublisher.publishEvent(EventStatusChangedEvent.builder()
                .eventId(event.getId())
                .eventName(event.getName())
                .eventType(event.getType().name())
                .createdBy(event.getCreatedBy())
                .fromStatus(from)
                .toStatus(to)
                .actorId(actor.userId())
                .reason(reason)
                .timestamp(clock.instant())
                .build());
    }
}

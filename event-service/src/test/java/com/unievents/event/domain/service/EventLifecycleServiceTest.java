package com.unievents.event.domain.service;

import com.unievents.common.exception.ConflictException;
import com.unievents.common.exception.ForbiddenException;
import com.unievents.event.api.dto.EventRequest;
import com.unievents.event.api.dto.EventResponse;
import com.unievents.event.api.dto.TransitionRequest;
import com.unievents.event.domain.lifecycle.EventLifecycleStateMachine;
import com.unievents.event.domain.model.Actor;
import com.unievents.event.domain.model.Event;
import com.unievents.event.domain.model.EventStatus;
import com.unievents.event.domain.model.EventType;
import com.unievents.event.domain.model.UserRole;
import com.unievents.event.domain.model.payload.TripPayload;
import com.unievents.event.domain.model.payload.WorkshopPayload;
import com.unievents.event.domain.repository.EventRepository;
import com.unievents.event.events.EventStatusChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class EventLifecycleServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
    private static final UUID PROFESSOR_ID = UUID.randomUUID();

    @Mock
    private EventRepository eventRepository;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private EventLifecycleService service;
    private final Actor professor = Actor.user(PROFESSOR_ID, UserRole.PROFESSOR);
    private final Actor office = Actor.user(UUID.randomUUID(), UserRole.EVENT_OFFICE);

    @BeforeEach
    void setUp() {
        service = new EventLifecycleService(eventRepository, new EventLifecycleStateMachine(), eventPublisher,
                Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(eventRepository.saveAndFlush(any(Event.class))).thenAnswer(inv -> {
            Event event = inv.getArgument(0);
            if (event.getId() == null) {
                event.setId(UUID.randomUUID());
            }
            return event;
        });
    }

    private static EventRequest workshopDraft(Integer capacity, boolean submit) {
        return new EventRequest(
                "Intro to Compilers",
                "Hands-on parsing workshop",
                EventType.WORKSHOP,
                "Hall C",
                NOW.plus(Duration.ofDays(10)),
                NOW.plus(Duration.ofDays(10)).plus(Duration.ofHours(3)),
                capacity,
                NOW.plus(Duration.ofDays(8)),
                0L,
                Set.of(UserRole.STUDENT, UserRole.TA),
                new WorkshopPayload("Day 1: lexing", "Engineering", List.of(PROFESSOR_ID), 500_000L, null, null),
                submit);
    }

    private Event stored(EventStatus status, int registered) {
        Event event = Event.builder()
                .id(UUID.randomUUID())
                .name("Intro to Compilers")
                .type(EventType.WORKSHOP)
                .status(status)
                .startDate(NOW.plus(Duration.ofDays(10)))
                .endDate(NOW.plus(Duration.ofDays(10)).plus(Duration.ofHours(3)))
                .capacity(40)
                .registeredCount(registered)
                .createdBy(PROFESSOR_ID)
                .build();
        given(eventRepository.findById(event.getId())).willReturn(Optional.of(event));
        return event;
    }

    @Test
    @DisplayName("professor creates a workshop draft and submits it for review in one call")
    void submitEvent_draftAndSubmit() {
        EventResponse response = service.submitEvent(workshopDraft(40, true), professor);

        assertThat(response.status()).isEqualTo(EventStatus.PENDING_APPROVAL);
        assertThat(response.createdBy()).isEqualTo(PROFESSOR_ID);
        assertThat(response.registeredCount()).isZero();
        assertThat(response.restrictedTo()).containsExactlyInAnyOrder(UserRole.STUDENT, UserRole.TA);

        ArgumentCaptor<Object> fact = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(fact.capture());
        EventStatusChangedEvent changed = (EventStatusChangedEvent) fact.getValue();
        assertThat(changed.getFromStatus()).isEqualTo("DRAFT");
        assertThat(changed.getToStatus()).isEqualTo("PENDING_APPROVAL");
    }

    @Test
    @DisplayName("a student cannot create events")
    void submitEvent_forbiddenRole() {
        assertThatThrownBy(() -> service.submitEvent(workshopDraft(40, false), Actor.user(UUID.randomUUID(), UserRole.STUDENT)))
                .isInstanceOf(ForbiddenException.class);
        verify(eventRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("payload kind must match the event type; end must follow start")
    void submitEvent_validation() {
        EventRequest mismatched = new EventRequest("Trip", null, EventType.WORKSHOP, null,
                NOW.plusSeconds(3600), NOW.plusSeconds(7200), null, null, null, null,
                new TripPayload("Main gate"), false);
        assertThatThrownBy(() -> service.submitEvent(mismatched, professor))
                .extracting("errorCode")
                .isEqualTo("VALIDATION_ERROR");

        EventRequest backwards = new EventRequest("Workshop", null, EventType.WORKSHOP, null,
                NOW.plusSeconds(7200), NOW.plusSeconds(3600), null, null, null, null, null, false);
        assertThatThrownBy(() -> service.submitEvent(backwards, professor))
                .extracting("errorCode")
                .isEqualTo("VALIDATION_ERROR");
    }

    @Test
    @DisplayName("capacity cannot drop below seats already taken")
    void updateEvent_capacityBelowRegistered() {
        Event event = stored(EventStatus.DRAFT, 12);

        assertThatThrownBy(() -> service.updateEvent(event.getId(), workshopDraft(10, false), professor))
                .extracting("errorCode")
                .isEqualTo("VALIDATION_ERROR");
        assertThat(event.getCapacity()).isEqualTo(40);
    }

    @Test
    @DisplayName("rejected events and non-creators cannot edit")
    void updateEvent_notEditable() {
        Event rejected = stored(EventStatus.REJECTED, 0);
        assertThatThrownBy(() -> service.updateEvent(rejected.getId(), workshopDraft(40, false), professor))
                .isInstanceOf(ForbiddenException.class);

        Event draft = stored(EventStatus.DRAFT, 0);
        assertThatThrownBy(() -> service.updateEvent(draft.getId(), workshopDraft(40, false), office))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("creator edits own draft")
    void updateEvent_byCreator() {
        Event event = stored(EventStatus.NEEDS_EDITS, 0);

        EventResponse response = service.updateEvent(event.getId(), workshopDraft(60, false), professor);

        assertThat(response.capacity()).isEqualTo(60);
        assertThat(response.location()).isEqualTo("Hall C");
        assertThat(response.status()).isEqualTo(EventStatus.NEEDS_EDITS);
    }

    @Test
    @DisplayName("rejection stores the reason and publishes it")
    void transitionEvent_rejectWithReason() {
        Event event = stored(EventStatus.PENDING_APPROVAL, 0);

        EventResponse response = service.transitionEvent(event.getId(),
                new TransitionRequest(EventStatus.REJECTED, "Out of budget"), office);

        assertThat(response.status()).isEqualTo(EventStatus.REJECTED);
        assertThat(response.rejectionReason()).isEqualTo("Out of budget");
        ArgumentCaptor<Object> fact = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publishEvent(fact.capture());
        assertThat(((EventStatusChangedEvent) fact.getValue()).getReason()).isEqualTo("Out of budget");
    }

    @Test
    @DisplayName("a concurrent transition on the same event surfaces as CONCURRENT_MODIFICATION")
    void transitionEvent_concurrentModification() {
        Event event = stored(EventStatus.PENDING_APPROVAL, 0);
        willThrow(new ObjectOptimisticLockingFailureException(Event.class, event.getId()))
                .given(eventRepository).saveAndFlush(event);

        assertThatThrownBy(() -> service.transitionEvent(event.getId(),
                new TransitionRequest(EventStatus.APPROVED, null), office))
                .isInstanceOf(ConflictException.class)
                .extracting("errorCode")
                .isEqualTo("CONCURRENT_MODIFICATION");
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("archiving twice publishes once; unarchive restores the flag")
    void archiveAndUnarchive() {
        Event event = stored(EventStatus.COMPLETED, 0);

        service.transitionEvent(event.getId(), new TransitionRequest(EventStatus.ARCHIVED, null), office);
        service.transitionEvent(event.getId(), new TransitionRequest(EventStatus.ARCHIVED, null), office);
        assertThat(event.isArchived()).isTrue();
        assertThat(event.getStatus()).isEqualTo(EventStatus.COMPLETED);

        EventResponse response = service.unarchiveEvent(event.getId(), office);
        assertThat(response.archived()).isFalse();

        verify(eventPublisher, times(2)).publishEvent(any(EventStatusChangedEvent.class));
    }

    @Test
    @DisplayName("completeEndedEvent moves ended PUBLISHED events to COMPLETED as the system")
    void completeEndedEvent() {
        Event event = stored(EventStatus.PUBLISHED, 3);
        event.setStartDate(NOW.minus(Duration.ofHours(5)));
        event.setEndDate(NOW.minus(Duration.ofHours(1)));

        assertThat(service.completeEndedEvent(event.getId())).isTrue();
        assertThat(event.getStatus()).isEqualTo(EventStatus.COMPLETED);

        assertThat(service.completeEndedEvent(event.getId())).isFalse();
    }

    @Test
    @DisplayName("completeEndedEvent leaves events that have not ended")
    void completeEndedEvent_notEnded() {
        Event event = stored(EventStatus.PUBLISHED, 3);

        assertThat(service.completeEndedEvent(event.getId())).isFalse();
        assertThat(event.getStatus()).isEqualTo(EventStatus.PUBLISHED);
    }
}

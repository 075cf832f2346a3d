package com.unievents.event.domain.strategy;

import com.unievents.common.exception.ConflictException;
import com.unievents.event.domain.model.Event;
import com.unievents.event.domain.model.EventStatus;
import com.unievents.event.domain.model.EventType;
import com.unievents.event.domain.repository.EventRepository;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link OptimisticLockCapacityStrategy}: a lost version race is retried once and
 * then reported as EVENT_FULL.
 */
@ExtendWith(MockitoExtension.class)
class OptimisticLockCapacityStrategyTest {

    private static final UUID EVENT_ID = UUID.randomUUID();

    @Mock
    private EventRepository repository;

    @Mock
    private EntityManager entityManager;

    private OptimisticLockCapacityStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new OptimisticLockCapacityStrategy(repository, entityManager);
    }

    private static Event event(int capacity, int registered, long version) {
        return Event.builder()
                .id(EVENT_ID)
                .type(EventType.CONFERENCE)
                .status(EventStatus.PUBLISHED)
                .capacity(capacity)
                .registeredCount(registered)
                .version(version)
                .build();
    }

    @Test
    @DisplayName("first attempt wins: one version-checked update")
    void acquireSeat_firstAttempt() {
        given(repository.findById(EVENT_ID)).willReturn(Optional.of(event(5, 1, 7L)));
        given(repository.incrementRegisteredCountIfVersionMatches(EVENT_ID, 7L)).willReturn(1);

        assertThatCode(() -> strategy.acquireSeat(EVENT_ID)).doesNotThrowAnyException();

        verify(repository, times(1)).incrementRegisteredCountIfVersionMatches(any(), any());
    }

    @Test
    @DisplayName("lost race is retried once with the fresh version")
    void acquireSeat_retriesOnce() {
        given(repository.findById(EVENT_ID))
                .willReturn(Optional.of(event(5, 1, 7L)))
                .willReturn(Optional.of(event(5, 2, 8L)));
        given(repository.incrementRegisteredCountIfVersionMatches(EVENT_ID, 7L)).willReturn(0);
        given(repository.incrementRegisteredCountIfVersionMatches(EVENT_ID, 8L)).willReturn(1);

        assertThatCode(() -> strategy.acquireSeat(EVENT_ID)).doesNotThrowAnyException();

        verify(repository).incrementRegisteredCountIfVersionMatches(EVENT_ID, 8L);
    }

    @Test
    @DisplayName("losing both attempts surfaces EVENT_FULL")
    void acquireSeat_lostTwice() {
        given(repository.findById(EVENT_ID))
                .willReturn(Optional.of(event(5, 1, 7L)))
                .willReturn(Optional.of(event(5, 2, 8L)));
        given(repository.incrementRegisteredCountIfVersionMatches(any(), any())).willReturn(0);

        assertThatThrownBy(() -> strategy.acquireSeat(EVENT_ID))
                .isInstanceOf(ConflictException.class)
                .extracting("errorCode")
                .isEqualTo("EVENT_FULL");

        verify(repository, times(OptimisticLockCapacityStrategy.MAX_ATTEMPTS))
                .incrementRegisteredCountIfVersionMatches(any(), any());
    }

    @Test
    @DisplayName("full event is rejected without attempting the update or retrying")
    void acquireSeat_full() {
        given(repository.findById(EVENT_ID)).willReturn(Optional.of(event(2, 2, 3L)));

        assertThatThrownBy(() -> strategy.acquireSeat(EVENT_ID))
                .isInstanceOf(ConflictException.class)
                .extracting("errorCode")
                .isEqualTo("EVENT_FULL");

        verify(repository, never()).incrementRegisteredCountIfVersionMatches(any(), any());
        verify(repository, times(1)).findById(EVENT_ID);
    }
}

package com.unievents.event.domain.strategy;

import com.unievents.common.exception.BusinessException;
import com.unievents.common.exception.ConflictException;
import com.unievents.event.domain.repository.EventRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link DistributedLockCapacityStrategy}.
 *
 * The lock only queues callers; the outcome is decided by the rows affected by
 * repository.incrementRegisteredCountIfAvailable(...), never by in-memory entity state.
 */
@ExtendWith(MockitoExtension.class)
class DistributedLockCapacityStrategyTest {

    private static final UUID EVENT_ID = UUID.fromString("11111111-2222-3333-4444-555555555555");

    @Mock
    private EventRepository repository;

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RLock lock;

    @InjectMocks
    private DistributedLockCapacityStrategy strategy;

    @Test
    @DisplayName("acquireSeat() succeeds when the guarded update affects 1 row, and releases the lock")
    void acquireSeat_success() throws Exception {
        given(redissonClient.getLock("lock:event:capacity:" + EVENT_ID)).willReturn(lock);
        given(lock.tryLock(anyLong(), anyLong(), any())).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);
        given(repository.incrementRegisteredCountIfAvailable(EVENT_ID)).willReturn(1);

        strategy.acquireSeat(EVENT_ID);

        verify(repository).incrementRegisteredCountIfAvailable(EVENT_ID);
        verify(lock).unlock();
    }

    @Test
    @DisplayName("acquireSeat() throws EVENT_FULL when the guarded update affects 0 rows")
    void acquireSeat_full() throws Exception {
        given(redissonClient.getLock("lock:event:capacity:" + EVENT_ID)).willReturn(lock);
        given(lock.tryLock(anyLong(), anyLong(), any())).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);
        given(repository.incrementRegisteredCountIfAvailable(EVENT_ID)).willReturn(0);

        assertThatThrownBy(() -> strategy.acquireSeat(EVENT_ID))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("full capacity")
                .extracting("errorCode")
                .isEqualTo("EVENT_FULL");

        verify(lock).unlock();
    }

    @Test
    @DisplayName("acquireSeat() reports CAPACITY_LOCK_UNAVAILABLE and never touches the row when the lock times out")
    void acquireSeat_lockNotAcquired() throws Exception {
        given(redissonClient.getLock("lock:event:capacity:" + EVENT_ID)).willReturn(lock);
        given(lock.tryLock(anyLong(), anyLong(), any())).willReturn(false);
        given(lock.isHeldByCurrentThread()).willReturn(false);

        assertThatThrownBy(() -> strategy.acquireSeat(EVENT_ID))
                .isInstanceOf(ConflictException.class)
                .extracting("errorCode")
                .isEqualTo("CAPACITY_LOCK_UNAVAILABLE");

        verify(repository, never()).incrementRegisteredCountIfAvailable(any());
        verify(lock, never()).unlock();
    }

    @Test
    @DisplayName("interrupt while waiting for the lock restores the interrupt flag")
    void acquireSeat_interrupted() throws Exception {
        given(redissonClient.getLock("lock:event:capacity:" + EVENT_ID)).willReturn(lock);
        given(lock.tryLock(anyLong(), anyLong(), any())).willThrow(new InterruptedException());
        given(lock.isHeldByCurrentThread()).willReturn(false);

        try {
            assertThatThrownBy(() -> strategy.acquireSeat(EVENT_ID))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode")
                    .isEqualTo("REGISTRATION_INTERRUPTED");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("strategy type")
    void strategyType() {
        assertThat(strategy.getStrategyType()).isEqualTo("DISTRIBUTED_LOCK");
    }
}

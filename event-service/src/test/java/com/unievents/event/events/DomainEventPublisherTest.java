package com.unievents.event.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DomainEventPublisherTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    @InjectMocks
    private DomainEventPublisher publisher;

    @Test
    @DisplayName("refund facts go to refund-requested keyed by registration id")
    void publishRefundRequested() {
        UUID registrationId = UUID.randomUUID();
        RefundRequestedEvent event = RefundRequestedEvent.builder()
                .registrationId(registrationId)
                .amount(15_000)
                .timestamp(Instant.now())
                .build();
        CompletableFuture<SendResult<String, Object>> future = new CompletableFuture<>();
        given(kafkaTemplate.send(anyString(), anyString(), any())).willReturn(future);

        publisher.publishRefundRequested(event);
        future.completeExceptionally(new IllegalStateException("broker unavailable"));

        verify(kafkaTemplate).send(eq("refund-requested"), eq(registrationId.toString()), eq(event));
    }

    @Test
    @DisplayName("status changes go to event-status-changed keyed by event id")
    void publishEventStatusChanged() {
        UUID eventId = UUID.randomUUID();
        EventStatusChangedEvent event = EventStatusChangedEvent.builder()
                .eventId(eventId)
                .fromStatus("APPROVED")
                .toStatus("PUBLISHED")
                .build();
        given(kafkaTemplate.send(anyString(), anyString(), any())).willReturn(new CompletableFuture<>());

        publisher.publishEventStatusChanged(event);

        verify(kafkaTemplate).send(eq("event-status-changed"), eq(eventId.toString()), eq(event));
    }
}

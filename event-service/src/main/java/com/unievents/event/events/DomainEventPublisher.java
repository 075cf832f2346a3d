package com.unievents.event.events;

import com.unievents.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka publisher for the facts the core emits.
 *
 * Topics:
 * - registration-created: keyed by registration id
 * - refund-requested: keyed by registration id
 * - event-status-changed: keyed by event id
 *
 * Sending is asynchronous; a failed send is logged and not retried here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DomainEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public void publishRegistrationCreated(RegistrationCreatedEvent event) {
        publish(Constants.TOPIC_REGISTRATION_CREATED, String.valueOf(event.getRegistrationId()), event);
    }

    public void publishRefundRequested(RefundRequestedEvent event) {
        publish(Constants.TOPIC_REFUND_REQUESTED, String.valueOf(event.getRegistrationId()), event);
    }

    public void publishEventStatusChanged(EventStatusChangedEvent event) {
        publish(Constants.TOPIC_EVENT_STATUS_CHANGED, String.valueOf(event.getEventId()), event);
    }

    private void publish(String topic, String key, Object event) {
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published successfully to topic {}: offset={}",
                        topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {} (key={})", topic, key, ex);
            }
        });
    }
}

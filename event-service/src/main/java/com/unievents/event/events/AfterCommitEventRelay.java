package com.unievents.event.events;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Services raise facts with ApplicationEventPublisher inside their transaction; this relay forwards
 * them to Kafka only once that transaction has committed, so a rolled-back registration or cancel
 * never produces a message.
 */
@Component
@RequiredArgsConstructor
public class AfterCommitEventRelay {

    private final DomainEventPublisher publisher;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRegistrationCreated(RegistrationCreatedEvent event) {
        publisher.publishRegistrationCreated(event);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRefundRequested(RefundRequestedEvent event) {
        publisher.publishRefundRequested(event);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onEventStatusChanged(EventStatusChangedEvent event) {
        publisher.publishEventStatusChanged(event);
    }
}

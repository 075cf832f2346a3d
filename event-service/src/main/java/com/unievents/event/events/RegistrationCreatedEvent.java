package com.unievents.event.events;

import com.unievents.event.domain.model.Registration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a registration is created.
 * Consumed by the notification collaborator (confirmation mail) and, for paid events, the payment
 * collaborator (checkout).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationCreatedEvent {
    private UUID registrationId;
    private UUID eventId;
    private UUID userId;
    private String status;
    private String paymentStatus;
    private long paymentAmount;
    private String paymentMethod;
    private Instant timestamp;

    public static RegistrationCreatedEvent of(Registration registration, Instant timestamp) {
        return RegistrationCreatedEvent.builder()
                .registrationId(registration.getId())
                .eventId(registration.getEventId())
                .userId(registration.getUserId())
                .status(registration.getStatus().name())
                .paymentStatus(registration.getPaymentStatus().name())
                .paymentAmount(registration.getPaymentAmount())
                .paymentMethod(registration.getPaymentMethod() == null ? null : registration.getPaymentMethod().name())
                .timestamp(timestamp)
                .build();
    }
}

package com.unievents.event.events;

import com.unievents.event.domain.model.Registration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Published exactly once per registration whose completed payment has to be given back.
 * The payment collaborator performs the actual refund.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefundRequestedEvent {
    private UUID registrationId;
    private UUID eventId;
    private UUID userId;
    private long amount;
    private String paymentMethod;
    private String reason;
    private Instant timestamp;

    public static RefundRequestedEvent of(Registration registration, String reason, Instant timestamp) {
        return RefundRequestedEvent.builder()
                .registrationId(registration.getId())
                .eventId(registration.getEventId())
                .userId(registration.getUserId())
                .amount(registration.getPaymentAmount())
                .paymentMethod(registration.getPaymentMethod() == null ? null : registration.getPaymentMethod().name())
                .reason(reason)
                .timestamp(timestamp)
                .build();
    }
}

package com.unievents.event.api.dto;

import com.unievents.event.domain.model.PaymentMethod;
import com.unievents.event.domain.model.PaymentStatus;
import com.unievents.event.domain.model.Registration;
import com.unievents.event.domain.model.RegistrationStatus;

import java.time.Instant;
import java.util.UUID;

public record RegistrationResponse(
        UUID id,
        UUID eventId,
        UUID userId,
        RegistrationStatus status,
        PaymentStatus paymentStatus,
        long paymentAmount,
        PaymentMethod paymentMethod,
        boolean attended,
        boolean certificateIssued,
        Instant createdAt
) {
    public static RegistrationResponse from(Registration registration) {
        return new RegistrationResponse(
                registration.getId(),
                registration.getEventId(),
                registration.getUserId(),
                registration.getStatus(),
                registration.getPaymentStatus(),
                registration.getPaymentAmount(),
                registration.getPaymentMethod(),
                registration.isAttended(),
                registration.isCertificateIssued(),
                registration.getCreatedAt()
        );
    }
}

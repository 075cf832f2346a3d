package com.unievents.event.api.dto;

import com.unievents.event.domain.model.PaymentMethod;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record RegisterRequest(
        @NotNull(message = "Event ID cannot be null")
        UUID eventId,

        @NotNull(message = "User ID cannot be null")
        UUID userId,

        // required when the event has a price
        PaymentMethod paymentMethod
) {
}

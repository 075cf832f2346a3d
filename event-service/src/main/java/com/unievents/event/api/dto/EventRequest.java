package com.unievents.event.api.dto;

import com.unievents.event.domain.model.EventType;
import com.unievents.event.domain.model.UserRole;
import com.unievents.event.domain.model.payload.EventPayload;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.Set;

/**
 * Event draft used for both creation and update.
 * On update the type must match the stored one and submitForReview is ignored.
 */
public record EventRequest(
        @NotBlank(message = "Name cannot be blank")
        @Size(max = 255, message = "Name must be at most 255 characters")
        String name,

        String description,

        @NotNull(message = "Event type cannot be null")
        EventType type,

        String location,

        @NotNull(message = "Start date cannot be null")
        Instant startDate,

        @NotNull(message = "End date cannot be null")
        Instant endDate,

        @Positive(message = "Capacity must be positive")
        Integer capacity,

        Instant registrationDeadline,

        @PositiveOrZero(message = "Price cannot be negative")
        Long price,

        Set<UserRole> restrictedTo,

        EventPayload payload,

        boolean submitForReview
) {
}

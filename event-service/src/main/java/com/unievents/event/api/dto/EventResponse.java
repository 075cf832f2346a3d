package com.unievents.event.api.dto;

import com.unievents.event.domain.model.Event;
import com.unievents.event.domain.model.EventStatus;
import com.unievents.event.domain.model.EventType;
import com.unievents.event.domain.model.UserRole;
import com.unievents.event.domain.model.payload.EventPayload;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public record EventResponse(
        UUID id,
        String name,
        String description,
        EventType type,
        EventStatus status,
        boolean archived,
        String location,
        Instant startDate,
        Instant endDate,
        Integer capacity,
        int registeredCount,
        Instant registrationDeadline,
        long price,
        Set<UserRole> restrictedTo,
        String rejectionReason,
        EventPayload payload,
        UUID createdBy,
        Instant createdAt,
        Instant updatedAt
) {
    public static EventResponse from(Event event) {
        return new EventResponse(
                event.getId(),
                event.getName(),
                event.getDescription(),
                event.getType(),
                event.getStatus(),
                event.isArchived(),
                event.getLocation(),
                event.getStartDate(),
                event.getEndDate(),
                event.getCapacity(),
                event.getRegisteredCount(),
                event.getRegistrationDeadline(),
                event.getPrice(),
                Set.copyOf(event.getRestrictedTo()),
                event.getRejectionReason(),
                event.getPayload(),
                event.getCreatedBy(),
                event.getCreatedAt(),
                event.getUpdatedAt()
        );
    }
}

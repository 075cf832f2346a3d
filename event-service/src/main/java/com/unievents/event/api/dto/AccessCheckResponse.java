package com.unievents.event.api.dto;

import com.unievents.event.domain.access.AccessDecision;

import java.util.UUID;

public record AccessCheckResponse(
        UUID eventId,
        UUID userId,
        boolean granted,
        AccessDecision decision
) {
    public static AccessCheckResponse of(UUID eventId, UUID userId, AccessDecision decision) {
        return new AccessCheckResponse(eventId, userId, decision.granted(), decision);
    }
}

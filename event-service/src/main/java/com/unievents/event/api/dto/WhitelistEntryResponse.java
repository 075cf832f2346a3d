package com.unievents.event.api.dto;

import com.unievents.event.domain.model.UserRole;
import com.unievents.event.domain.model.WhitelistEntry;

import java.time.Instant;
import java.util.UUID;

public record WhitelistEntryResponse(
        UUID id,
        UUID eventId,
        UUID userId,
        UserRole role,
        UUID createdBy,
        Instant createdAt
) {
    public static WhitelistEntryResponse from(WhitelistEntry entry) {
        return new WhitelistEntryResponse(
                entry.getId(),
                entry.getEventId(),
                entry.getUserId(),
                entry.getRole(),
                entry.getCreatedBy(),
                entry.getCreatedAt()
        );
    }
}

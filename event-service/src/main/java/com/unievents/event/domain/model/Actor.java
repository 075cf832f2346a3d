package com.unievents.event.domain.model;

import java.util.UUID;

/**
 * Who is performing an operation. The system actor is used by scheduled jobs
 * (automatic completion) and has no user id or role.
 */
public record Actor(UUID userId, UserRole role, UserStatus status, boolean system) {

    private static final Actor SYSTEM = new Actor(null, null, UserStatus.ACTIVE, true);

    public static Actor systemActor() {
        return SYSTEM;
    }

    public static Actor of(UserAccount account) {
        return new Actor(account.getId(), account.getRole(), account.getStatus(), false);
    }

    public static Actor user(UUID userId, UserRole role) {
        return new Actor(userId, role, UserStatus.ACTIVE, false);
    }

    public boolean isActive() {
        return system || status == UserStatus.ACTIVE;
    }

    public boolean isEventOffice() {
        return !system && role != null && role.isEventOffice() && isActive();
    }

    public boolean is(UUID otherUserId) {
        return !system && userId != null && userId.equals(otherUserId);
    }
}

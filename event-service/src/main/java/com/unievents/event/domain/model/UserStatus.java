package com.unievents.event.domain.model;

public enum UserStatus {
    ACTIVE,
    BLOCKED,
    PENDING_VERIFICATION
}

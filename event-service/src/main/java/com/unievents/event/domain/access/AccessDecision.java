package com.unievents.event.domain.access;

public enum AccessDecision {
    GRANTED_UNRESTRICTED(true),
    GRANTED_BY_ROLE(true),
    GRANTED_BY_USER_WHITELIST(true),
    GRANTED_BY_ROLE_WHITELIST(true),
    DENIED_INACTIVE_USER(false),
    DENIED_RESTRICTED(false);

    private final boolean granted;

    AccessDecision(boolean granted) {
        this.granted = granted;
    }

    public boolean granted() {
        return granted;
    }
}

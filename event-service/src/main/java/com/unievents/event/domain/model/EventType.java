package com.unievents.event.domain.model;

public enum EventType {
    WORKSHOP,
    TRIP,
    BAZAAR,
    CONFERENCE,
    GYM_SESSION,
    BOOTH
}

package com.unievents.event.domain.model;

public enum RegistrationStatus {
    PENDING,
    CONFIRMED,
    CANCELLED
}

package com.unievents.event.domain.model;

public enum PaymentStatus {
    PENDING,
    COMPLETED,
    REFUNDED,
    FAILED
}

package com.unievents.event.domain.model;

public enum PaymentMethod {
    CREDIT_CARD,
    DEBIT_CARD,
    WALLET
}

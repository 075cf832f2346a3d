package com.unievents.event.domain.model.payload;

public enum GymSessionType {
    YOGA,
    PILATES,
    AEROBICS,
    ZUMBA,
    CROSS_CIRCUIT,
    KICK_BOXING
}

package com.unievents.event.domain.model.payload;

import com.unievents.event.domain.model.EventType;

public record GymSessionPayload(GymSessionType sessionType, Integer durationMinutes) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.GYM_SESSION;
    }
}

package com.unievents.event.domain.model.payload;

import com.unievents.event.domain.model.EventType;

public record TripPayload(String meetingPoint) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.TRIP;
    }
}

package com.unievents.event.domain.model.payload;

import com.unievents.event.domain.model.EventType;

import java.util.UUID;

public record BoothPayload(UUID vendorId, String boothSize) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.BOOTH;
    }
}

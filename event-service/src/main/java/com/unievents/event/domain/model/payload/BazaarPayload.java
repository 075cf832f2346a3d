package com.unievents.event.domain.model.payload;

import com.unievents.event.domain.model.EventType;

import java.util.List;
import java.util.UUID;

public record BazaarPayload(List<UUID> vendorIds) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.BAZAAR;
    }
}

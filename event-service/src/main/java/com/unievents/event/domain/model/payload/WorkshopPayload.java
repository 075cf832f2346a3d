package com.unievents.event.domain.model.payload;

import com.unievents.event.domain.model.EventType;

import java.util.List;
import java.util.UUID;

/**
 * @param requiredBudget minor currency units
 */
public record WorkshopPayload(
        String fullAgenda,
        String faculty,
        List<UUID> professorIds,
        Long requiredBudget,
        FundingSource fundingSource,
        String extraResources
) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.WORKSHOP;
    }
}

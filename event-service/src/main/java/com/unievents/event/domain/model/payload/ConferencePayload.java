package com.unievents.event.domain.model.payload;

import com.unievents.event.domain.model.EventType;

public record ConferencePayload(
        String websiteUrl,
        String fullAgenda,
        Long requiredBudget,
        FundingSource fundingSource,
        String extraResources
) implements EventPayload {

    @Override
    public EventType eventType() {
        return EventType.CONFERENCE;
    }
}

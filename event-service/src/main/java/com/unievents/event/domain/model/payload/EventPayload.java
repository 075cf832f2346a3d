package com.unievents.event.domain.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.unievents.event.domain.model.EventType;

/**
 * Type-specific details of an event, tagged by {@link EventType}.
 * Stored as JSON next to the common event columns; the "kind" tag must agree with the event's type.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WorkshopPayload.class, name = "WORKSHOP"),
        @JsonSubTypes.Type(value = TripPayload.class, name = "TRIP"),
        @JsonSubTypes.Type(value = BazaarPayload.class, name = "BAZAAR"),
        @JsonSubTypes.Type(value = ConferencePayload.class, name = "CONFERENCE"),
        @JsonSubTypes.Type(value = GymSessionPayload.class, name = "GYM_SESSION"),
        @JsonSubTypes.Type(value = BoothPayload.class, name = "BOOTH")
})
public interface EventPayload {

    @JsonIgnore
    EventType eventType();
}

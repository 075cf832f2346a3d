package com.unievents.event.domain.lifecycle;

import com.unievents.event.domain.model.EventStatus;
import com.unievents.event.domain.model.EventType;

import java.util.Set;

/**
 * One row of the transition table: the edge from → to is allowed for the given actor class
 * on events of the given types.
 */
public record TransitionRule(EventStatus from, EventStatus to, ActorClass actor, Set<EventType> eventTypes) {

    public boolean isEdge(EventStatus fromStatus, EventStatus toStatus) {
        return from == fromStatus && to == toStatus;
    }

    public boolean permits(EventType type, Set<ActorClass> actorClasses) {
        return eventTypes.contains(type) && actorClasses.contains(actor);
    }
}

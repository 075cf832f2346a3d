package com.unievents.event.domain.lifecycle;

import com.unievents.event.domain.model.Actor;
import com.unievents.event.domain.model.Event;

import java.util.EnumSet;
import java.util.Set;

/**
 * The capacities in which an actor can act on a given event. One user can hold several
 * (an Event Office member who also created the event is both CREATOR and EVENT_OFFICE).
 */
public enum ActorClass {
    CREATOR,
    EVENT_OFFICE,
    SYSTEM;

    public static Set<ActorClass> of(Event event, Actor actor) {
        Set<ActorClass> classes = EnumSet.noneOf(ActorClass.class);
        if (actor == null) return classes;
        if (actor.system()) {
            classes.add(SYSTEM);
            return classes;
        }
        if (!actor.isActive()) return classes;
        if (actor.is(event.getCreatedBy())) {
            classes.add(CREATOR);
        }
        if (actor.isEventOffice()) {
            classes.add(EVENT_OFFICE);
        }
        return classes;
    }
}

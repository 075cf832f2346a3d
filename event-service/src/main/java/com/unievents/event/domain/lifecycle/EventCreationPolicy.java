package com.unievents.event.domain.lifecycle;

import com.unievents.event.domain.model.Actor;
import com.unievents.event.domain.model.EventType;
import com.unievents.event.domain.model.UserRole;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Which roles may create which event types.
 */
public final class EventCreationPolicy {

    private static final Map<EventType, Set<UserRole>> CREATORS = new EnumMap<>(EventType.class);

    static {
        Set<UserRole> office = EnumSet.of(UserRole.EVENT_OFFICE, UserRole.ADMIN);
        CREATORS.put(EventType.WORKSHOP, EnumSet.of(UserRole.PROFESSOR, UserRole.EVENT_OFFICE, UserRole.ADMIN));
        CREATORS.put(EventType.BOOTH, EnumSet.of(UserRole.VENDOR, UserRole.EVENT_OFFICE, UserRole.ADMIN));
        CREATORS.put(EventType.TRIP, office);
        CREATORS.put(EventType.BAZAAR, office);
        CREATORS.put(EventType.CONFERENCE, office);
        CREATORS.put(EventType.GYM_SESSION, office);
    }

    private EventCreationPolicy() {
    }

    public static boolean mayCreate(Actor actor, EventType type) {
        if (actor == null || actor.system() || !actor.isActive() || type == null) return false;
        return CREATORS.getOrDefault(type, Set.of()).contains(actor.role());
    }
}

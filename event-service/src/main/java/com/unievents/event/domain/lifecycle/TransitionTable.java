package com.unievents.event.domain.lifecycle;

import com.unievents.event.domain.model.EventStatus;
import com.unievents.event.domain.model.EventType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.unievents.event.domain.lifecycle.ActorClass.CREATOR;
import static com.unievents.event.domain.lifecycle.ActorClass.EVENT_OFFICE;
import static com.unievents.event.domain.lifecycle.ActorClass.SYSTEM;
import static com.unievents.event.domain.model.EventStatus.*;

/**
 * The complete set of workflow transitions and who may trigger them.
 * Every permission decision of the lifecycle is answered from this table alone.
 *
 * <pre>
 * DRAFT            → PENDING_APPROVAL  creator
 * PENDING_APPROVAL → APPROVED          event office
 * PENDING_APPROVAL → NEEDS_EDITS       event office
 * NEEDS_EDITS      → PENDING_APPROVAL  creator
 * PENDING_APPROVAL → REJECTED          event office
 * NEEDS_EDITS      → REJECTED          event office
 * APPROVED         → PUBLISHED         event office; creator for non-workshop types
 * PUBLISHED        → CANCELLED         event office
 * PUBLISHED        → COMPLETED         system, event office
 * </pre>
 *
 * Archiving is a flag, handled by {@link EventLifecycleStateMachine#archive}.
 */
public final class TransitionTable {

    private static final Set<EventType> ALL_TYPES = Collections.unmodifiableSet(EnumSet.allOf(EventType.class));
    private static final Set<EventType> NON_WORKSHOP_TYPES =
            Collections.unmodifiableSet(EnumSet.complementOf(EnumSet.of(EventType.WORKSHOP)));

    /** Targets that must be accompanied by a non-empty reason for the creator. */
    private static final Set<EventStatus> REASON_REQUIRED = Collections.unmodifiableSet(EnumSet.of(REJECTED, NEEDS_EDITS));

    private static final List<TransitionRule> RULES = List.of(
            rule(DRAFT, PENDING_APPROVAL, CREATOR),
            rule(PENDING_APPROVAL, APPROVED, EVENT_OFFICE),
            rule(PENDING_APPROVAL, NEEDS_EDITS, EVENT_OFFICE),
            rule(NEEDS_EDITS, PENDING_APPROVAL, CREATOR),
            rule(PENDING_APPROVAL, REJECTED, EVENT_OFFICE),
            rule(NEEDS_EDITS, REJECTED, EVENT_OFFICE),
            rule(APPROVED, PUBLISHED, EVENT_OFFICE),
            new TransitionRule(APPROVED, PUBLISHED, CREATOR, NON_WORKSHOP_TYPES),
            rule(PUBLISHED, CANCELLED, EVENT_OFFICE),
            rule(PUBLISHED, COMPLETED, SYSTEM),
            rule(PUBLISHED, COMPLETED, EVENT_OFFICE)
    );

    private TransitionTable() {
    }

    private static TransitionRule rule(EventStatus from, EventStatus to, ActorClass actor) {
        return new TransitionRule(from, to, actor, ALL_TYPES);
    }

    public static boolean hasEdge(EventStatus from, EventStatus to) {
        return RULES.stream().anyMatch(r -> r.isEdge(from, to));
    }

    public static boolean permits(EventStatus from, EventStatus to, EventType type, Set<ActorClass> actorClasses) {
        return RULES.stream().anyMatch(r -> r.isEdge(from, to) && r.permits(type, actorClasses));
    }

    public static boolean requiresReason(EventStatus to) {
        return REASON_REQUIRED.contains(to);
    }

    public static List<TransitionRule> rules() {
        return RULES;
    }

    /** Targets reachable from the given status, regardless of actor. */
    public static Set<EventStatus> targetsFrom(EventStatus from) {
        List<EventStatus> targets = new ArrayList<>();
        for (TransitionRule rule : RULES) {
            if (rule.from() == from) {
                targets.add(rule.to());
            }
        }
        return targets.isEmpty() ? EnumSet.noneOf(EventStatus.class) : EnumSet.copyOf(targets);
    }
}

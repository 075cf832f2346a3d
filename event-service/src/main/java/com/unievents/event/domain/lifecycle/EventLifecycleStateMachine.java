package com.unievents.event.domain.lifecycle;

import com.unievents.common.exception.BusinessException;
import com.unievents.common.exception.ConflictException;
import com.unievents.common.exception.ForbiddenException;
import com.unievents.event.domain.exception.EventErrorCodes;
import com.unievents.event.domain.model.Actor;
import com.unievents.event.domain.model.Event;
import com.unievents.event.domain.model.EventStatus;
import com.unievents.event.domain.model.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Owns the event's status field.
 *
 * All checks run before the event is touched, so a rejected call leaves it exactly as it was.
 * The state machine mutates the entity in memory only; persisting it is the caller's job.
 */
@Slf4j
@Component
public class EventLifecycleStateMachine {

    /**
     * Moves the event to {@code target}. ARCHIVED is delegated to {@link #archive(Event, Actor)}.
     *
     * @param reason required for REJECTED and NEEDS_EDITS, ignored otherwise
     * @return the same event instance, transitioned
     */
    public Event transition(Event event, EventStatus target, Actor actor, String reason) {
        if (target == null) {
            throw new BusinessException("Target status is required", EventErrorCodes.VALIDATION_ERROR);
        }
        if (target == EventStatus.ARCHIVED) {
            archive(event, actor);
            return event;
        }
        if (event.isArchived()) {
            throw new ConflictException(
                    String.format("Event %s is archived; unarchive it before changing its status", event.getId()),
                    EventErrorCodes.ALREADY_TERMINAL);
        }

        EventStatus from = event.getStatus();
        if (!TransitionTable.hasEdge(from, target)) {
            throw new ConflictException(
                    String.format("Transition %s -> %s is not allowed", from, target),
                    EventErrorCodes.INVALID_TRANSITION);
        }

        Set<ActorClass> actorClasses = ActorClass.of(event, actor);
        if (!TransitionTable.permits(from, target, event.getType(), actorClasses)) {
            throw new ForbiddenException(
                    String.format("Actor may not move %s event from %s to %s", event.getType(), from, target),
                    EventErrorCodes.FORBIDDEN_TRANSITION);
        }

        if (TransitionTable.requiresReason(target) && (reason == null || reason.isBlank())) {
            throw new BusinessException(
                    String.format("A reason is required when moving an event to %s", target),
                    EventErrorCodes.REASON_REQUIRED);
        }

        applyReason(event, from, target, reason);
        event.setStatus(target);
        log.debug("Event {} transitioned {} -> {} by {}", event.getId(), from, target, describe(actor));
        return event;
    }

    /**
     * Sets the archived flag. Idempotent.
     *
     * @return true if the flag changed
     */
    public boolean archive(Event event, Actor actor) {
        requireEventOffice(event, actor, "archive");
        if (event.isArchived()) return false;
        event.setArchived(true);
        return true;
    }

    /**
     * Clears the archived flag. Idempotent.
     *
     * @return true if the flag changed
     */
    public boolean unarchive(Event event, Actor actor) {
        requireEventOffice(event, actor, "unarchive");
        if (!event.isArchived()) return false;
        event.setArchived(false);
        return true;
    }

    /**
     * Whether the actor may edit the event's details: only its creator, never once REJECTED,
     * and Event Office / Admin never edit workshops.
     */
    public boolean isEditable(Event event, Actor actor) {
        if (actor == null || actor.system() || !actor.isActive()) return false;
        if (!actor.is(event.getCreatedBy())) return false;
        if (event.getStatus() == EventStatus.REJECTED) return false;
        return !(event.getType() == EventType.WORKSHOP && actor.isEventOffice());
    }

    private void requireEventOffice(Event event, Actor actor, String operation) {
        if (!ActorClass.of(event, actor).contains(ActorClass.EVENT_OFFICE)) {
            throw new ForbiddenException(
                    String.format("Only Event Office or Admin may %s event %s", operation, event.getId()),
                    EventErrorCodes.FORBIDDEN_TRANSITION);
        }
    }

    private void applyReason(Event event, EventStatus from, EventStatus target, String reason) {
        if (TransitionTable.requiresReason(target)) {
            event.setRejectionReason(reason.trim());
        } else if (from == EventStatus.NEEDS_EDITS) {
            // edits requested earlier have been addressed
            event.setRejectionReason(null);
        }
    }

    private String describe(Actor actor) {
        if (actor == null) return "unknown";
        return actor.system() ? "system" : actor.role() + ":" + actor.userId();
    }
}

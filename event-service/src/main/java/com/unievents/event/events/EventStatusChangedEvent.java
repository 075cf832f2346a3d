package com.unievents.event.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Published after every successful lifecycle transition, archive and unarchive.
 * toStatus is "ARCHIVED" / "UNARCHIVED" for the side flag.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventStatusChangedEvent {
    private UUID eventId;
    private String eventName;
    private String eventType;
    private UUID createdBy;
    private String fromStatus;
    private String toStatus;
    /** Null for the system actor. */
    private UUID actorId;
    private String reason;
    private Instant timestamp;
}

package com.unievents.event.domain.model;

import java.time.Instant;

/**
 * Projection returned to the reminder worker: the registration plus what it needs to word the reminder.
 */
public record DueReminder(Registration registration, String eventName, Instant startsAt) {
}

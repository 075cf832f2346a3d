package com.unievents.event.api.dto;

import com.unievents.event.domain.model.DueReminder;
import com.unievents.event.domain.model.RegistrationStatus;

import java.time.Instant;
import java.util.UUID;

public record DueReminderResponse(
        UUID registrationId,
        UUID eventId,
        UUID userId,
        RegistrationStatus status,
        String eventName,
        Instant startsAt
) {
    public static DueReminderResponse from(DueReminder reminder) {
        return new DueReminderResponse(
                reminder.registration().getId(),
                reminder.registration().getEventId(),
                reminder.registration().getUserId(),
                reminder.registration().getStatus(),
                reminder.eventName(),
                reminder.startsAt()
        );
    }
}

package com.unievents.fulfillment.client.dto;

import java.time.Instant;
import java.util.UUID;

public record DueReminder(
        UUID registrationId,
        UUID eventId,
        UUID userId,
        String eventName,
        Instant startsAt
) {
}

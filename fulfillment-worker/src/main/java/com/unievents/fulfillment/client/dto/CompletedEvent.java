package com.unievents.fulfillment.client.dto;

import java.time.Instant;
import java.util.UUID;

public record CompletedEvent(UUID id, String name, Instant endDate) {
}

package com.unievents.fulfillment.client.dto;

import java.util.UUID;

/**
 * The subset of a registration the certificate worker needs.
 */
public record EligibleRegistration(UUID id, UUID eventId, UUID userId) {
}

package com.unievents.event.domain.exception;

/**
 * Stable error codes returned to callers. Each precondition failure has its own code so the UI
 * collaborator can pick the right message.
 */
public final class EventErrorCodes {
    private EventErrorCodes() {
    }

    // validation
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String REASON_REQUIRED = "REASON_REQUIRED";

    // lifecycle
    public static final String INVALID_TRANSITION = "INVALID_TRANSITION";
    public static final String FORBIDDEN_TRANSITION = "FORBIDDEN_TRANSITION";
    public static final String ALREADY_TERMINAL = "ALREADY_TERMINAL";
    public static final String CONCURRENT_MODIFICATION = "CONCURRENT_MODIFICATION";

    // registration
    public static final String EVENT_NOT_REGISTRABLE = "EVENT_NOT_REGISTRABLE";
    public static final String DEADLINE_PASSED = "DEADLINE_PASSED";
    public static final String NOT_WHITELISTED = "NOT_WHITELISTED";
    public static final String ALREADY_REGISTERED = "ALREADY_REGISTERED";
    public static final String EVENT_FULL = "EVENT_FULL";
    public static final String ALREADY_CANCELLED = "ALREADY_CANCELLED";
    public static final String EVENT_STARTED = "EVENT_STARTED";
    public static final String CANCELLATION_WINDOW_CLOSED = "CANCELLATION_WINDOW_CLOSED";
    public static final String CAPACITY_LOCK_UNAVAILABLE = "CAPACITY_LOCK_UNAVAILABLE";

    // payment / fulfillment
    public static final String INVALID_PAYMENT_TRANSITION = "INVALID_PAYMENT_TRANSITION";
    public static final String REGISTRATION_NOT_CONFIRMED = "REGISTRATION_NOT_CONFIRMED";
    public static final String EVENT_NOT_COMPLETED = "EVENT_NOT_COMPLETED";

    // authorization
    public static final String FORBIDDEN = "FORBIDDEN";
}

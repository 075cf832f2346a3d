package com.unievents.common.util;

/**
 * Common constants shared by the core service and the fulfillment worker.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    /** Header carrying the id of the user performing a call. */
    public static final String ACTOR_HEADER = "X-Actor-Id";

    public static final String LOCK_PREFIX = "lock:event:capacity:";

    public static final String TOPIC_REGISTRATION_CREATED = "registration-created";
    public static final String TOPIC_REFUND_REQUESTED = "refund-requested";
    public static final String TOPIC_EVENT_STATUS_CHANGED = "event-status-changed";
}

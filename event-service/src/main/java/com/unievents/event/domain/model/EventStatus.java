package com.unievents.event.domain.model;

/**
 * Workflow status of an event.
 * ARCHIVED is accepted as a transition target only: archiving sets the event's archived flag
 * and leaves the workflow status untouched.
 */
public enum EventStatus {
    DRAFT,
    PENDING_APPROVAL,
    APPROVED,
    NEEDS_EDITS,
    REJECTED,
    PUBLISHED,
    CANCELLED,
    COMPLETED,
    ARCHIVED
}

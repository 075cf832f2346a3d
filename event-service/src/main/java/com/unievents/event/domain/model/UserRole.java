package com.unievents.event.domain.model;

public enum UserRole {
    STUDENT,
    STAFF,
    TA,
    PROFESSOR,
    ADMIN,
    EVENT_OFFICE,
    VENDOR;

    /** Event Office and Admin share every event-management permission. */
    public boolean isEventOffice() {
        return this == ADMIN || this == EVENT_OFFICE;
    }
}

package com.unievents.event.api.dto;

import com.unievents.event.domain.model.EventStatus;
import jakarta.validation.constraints.NotNull;

public record TransitionRequest(
        @NotNull(message = "Target status cannot be null")
        EventStatus targetStatus,

        // required for REJECTED and NEEDS_EDITS
        String reason
) {
}

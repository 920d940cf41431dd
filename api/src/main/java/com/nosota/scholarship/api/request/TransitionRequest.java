package com.nosota.scholarship.api.request;

import com.nosota.scholarship.api.model.ApplicationStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Moves an application to another review status (under review, document verification,
 * eligibility check, on hold, rejected).
 */
public record TransitionRequest(
        @NotNull(message = "Target status is required")
        ApplicationStatus targetStatus,

        @Size(max = 2000)
        String remarks
) {
}

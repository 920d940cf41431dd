package com.nosota.scholarship.error;

import com.nosota.scholarship.api.model.ApplicationStatus;
import lombok.Getter;

import java.util.Set;

/**
 * Requested status is not a legal successor of the current status.
 */
@Getter
public class InvalidTransitionException extends IllegalStateException implements ErrorCoded {

    public static final String CODE = "INVALID_TRANSITION";

    private final ApplicationStatus fromStatus;
    private final ApplicationStatus toStatus;

    public InvalidTransitionException(String applicationId, ApplicationStatus fromStatus,
                                      ApplicationStatus toStatus, Set<ApplicationStatus> allowed) {
        super(String.format("Invalid application status transition for %s: %s → %s. Allowed transitions from %s: %s",
                applicationId, fromStatus, toStatus, fromStatus, allowed));
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
    }

    public InvalidTransitionException(String message, ApplicationStatus fromStatus) {
        super(message);
        this.fromStatus = fromStatus;
        this.toStatus = null;
    }

    @Override
    public String getCode() {
        return CODE;
    }
}

package com.nosota.scholarship.event;

import com.nosota.scholarship.api.model.ApplicationStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Published when the institute approves (fully or partially) an application.
 */
public record ApplicationApprovedEvent(
        String applicationId,
        String studentId,
        ApplicationStatus status,
        BigDecimal approvedAmount,
        LocalDateTime approvedAt
) {
}

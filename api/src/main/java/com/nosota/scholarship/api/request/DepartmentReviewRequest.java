package com.nosota.scholarship.api.request;

import com.nosota.scholarship.api.model.DepartmentAction;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Department review of an institute-approved application.
 *
 * @param action      DEPT_APPROVE or DEPT_REJECT
 * @param remarks     Department remarks (required for DEPT_REJECT)
 * @param finalAmount Optional final approved amount for DEPT_APPROVE
 */
public record DepartmentReviewRequest(
        @NotNull(message = "Action is required")
        DepartmentAction action,

        @Size(max = 2000)
        String remarks,

        @Positive(message = "Final amount must be positive")
        @Digits(integer = 10, fraction = 2)
        BigDecimal finalAmount
) {
}

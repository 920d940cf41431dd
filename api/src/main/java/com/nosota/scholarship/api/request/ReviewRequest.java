package com.nosota.scholarship.api.request;

import com.nosota.scholarship.api.model.ReviewAction;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Institute review of a single application.
 *
 * @param action         Review action
 * @param remarks        Reviewer remarks (required for everything except APPROVE)
 * @param approvedAmount Approved amount for APPROVE; defaults to the requested amount
 */
public record ReviewRequest(
        @NotNull(message = "Action is required")
        ReviewAction action,

        @Size(max = 2000)
        String remarks,

        @Positive(message = "Approved amount must be positive")
        @Digits(integer = 10, fraction = 2)
        BigDecimal approvedAmount
) {
}

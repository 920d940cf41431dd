package com.nosota.scholarship.api.request;

import com.nosota.scholarship.api.model.DisbursementMethod;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Creates disbursements for forwarded applications and, for bank transfers,
 * executes the transfer right away.
 *
 * @param applicationIds One or more application IDs
 * @param method         Disbursement method
 * @param remarks        Finance remarks
 */
public record DisbursementRequest(
        @NotEmpty(message = "At least one application ID is required")
        @Size(max = 500)
        List<String> applicationIds,

        @NotNull(message = "Disbursement method is required")
        DisbursementMethod method,

        @Size(max = 2000)
        String remarks
) {
}

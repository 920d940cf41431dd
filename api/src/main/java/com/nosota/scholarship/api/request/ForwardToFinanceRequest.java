package com.nosota.scholarship.api.request;

import com.nosota.scholarship.api.model.Priority;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Forwards department-approved applications to finance.
 *
 * @param applicationIds Applications to forward
 * @param remarks        Forwarding remarks
 * @param priority       Finance priority for the batch (MEDIUM when omitted)
 */
public record ForwardToFinanceRequest(
        @NotEmpty(message = "At least one application ID is required")
        @Size(max = 500)
        List<String> applicationIds,

        @Size(max = 2000)
        String remarks,

        Priority priority
) {
}

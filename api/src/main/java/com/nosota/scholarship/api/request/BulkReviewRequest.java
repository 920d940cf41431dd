package com.nosota.scholarship.api.request;

import com.nosota.scholarship.api.model.ReviewAction;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Institute review applied to several applications. Only APPROVE and REJECT are accepted.
 */
public record BulkReviewRequest(
        @NotEmpty(message = "At least one application ID is required")
        @Size(max = 500)
        List<String> applicationIds,

        @NotNull(message = "Action is required")
        ReviewAction action,

        @Size(max = 2000)
        String remarks
) {
}

package com.nosota.scholarship.api.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Executes bank transfers for existing pending disbursements.
 */
public record TransferRequest(
        @NotEmpty(message = "At least one disbursement ID is required")
        @Size(max = 500)
        List<String> disbursementIds
) {
}

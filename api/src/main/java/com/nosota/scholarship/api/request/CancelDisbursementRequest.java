package com.nosota.scholarship.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CancelDisbursementRequest(
        @NotBlank(message = "Remarks are required to cancel a disbursement")
        @Size(max = 2000)
        String remarks
) {
}

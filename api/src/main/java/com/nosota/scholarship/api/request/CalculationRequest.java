package com.nosota.scholarship.api.request;

import com.nosota.scholarship.api.model.CalculationStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record CalculationRequest(
        @NotNull(message = "Strategy is required")
        CalculationStrategy strategy,

        @Valid
        CustomFactors customFactors
) {
}

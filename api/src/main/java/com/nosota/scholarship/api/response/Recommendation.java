package com.nosota.scholarship.api.response;

import com.nosota.scholarship.api.model.RecommendationType;

public record Recommendation(
        RecommendationType type,
        String message,
        String suggestion
) {
}

package com.nosota.scholarship.api.response;

import com.nosota.scholarship.api.model.DecisionOutcome;

import java.time.LocalDateTime;

public record StageDecisionResponse(
        DecisionOutcome outcome,
        String actorId,
        String remarks,
        LocalDateTime decidedAt
) {
}

package com.nosota.scholarship.api.response;

import com.nosota.scholarship.api.model.Priority;

import java.time.LocalDateTime;

public record FinanceForwardResponse(
        boolean forwarded,
        String actorId,
        String remarks,
        Priority priority,
        String batchId,
        LocalDateTime forwardedAt
) {
}

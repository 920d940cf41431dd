package com.nosota.scholarship.dto;

import com.nosota.scholarship.model.FinanceForward;
import com.nosota.scholarship.model.StageDecision;

/**
 * Per-stage decision state rebuilt from an application's decision log.
 */
public record StageDecisions(
        StageDecision instituteDecision,
        StageDecision departmentDecision,
        FinanceForward financeForward,
        int entryCount
) {
}

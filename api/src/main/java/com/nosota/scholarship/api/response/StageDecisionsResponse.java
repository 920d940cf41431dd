package com.nosota.scholarship.api.response;

/**
 * Per-stage decision state rebuilt by replaying the decision log.
 *
 * @param applicationId      Application ID
 * @param instituteDecision  Replayed institute decision
 * @param departmentDecision Replayed department decision
 * @param financeForward     Replayed finance forward
 * @param entryCount         Number of log entries replayed
 * @param consistent         True when the replayed state equals the stored decision fields
 */
public record StageDecisionsResponse(
        String applicationId,
        StageDecisionResponse instituteDecision,
        StageDecisionResponse departmentDecision,
        FinanceForwardResponse financeForward,
        int entryCount,
        boolean consistent
) {
}

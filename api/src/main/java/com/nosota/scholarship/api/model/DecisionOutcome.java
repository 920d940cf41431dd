package com.nosota.scholarship.api.model;

/**
 * Outcome of a stage decision (institute or department).
 */
public enum DecisionOutcome {
    /**
     * PENDING: The stage has not decided yet.
     */
    PENDING,
    APPROVED,
    REJECTED;

    public boolean isDecided() {
        return this != PENDING;
    }
}

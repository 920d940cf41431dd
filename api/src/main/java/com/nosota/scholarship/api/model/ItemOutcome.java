package com.nosota.scholarship.api.model;

/**
 * Outcome of a single item inside a batch operation.
 */
public enum ItemOutcome {
    SUCCESS,
    FAILED
}

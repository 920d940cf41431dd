package com.nosota.scholarship.api.model;

/**
 * Institute reviewer actions.
 */
public enum ReviewAction {
    APPROVE,
    REJECT,
    REQUEST_DOCUMENTS,
    HOLD
}

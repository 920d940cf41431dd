package com.nosota.scholarship.api.model;

/**
 * Organizational stage that produced a decision log entry.
 */
public enum Stage {
    /**
     * Actions taken by (or on behalf of) the student before review starts.
     */
    APPLICANT,
    INSTITUTE,
    DEPARTMENT,
    FINANCE
}

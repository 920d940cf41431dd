package com.nosota.scholarship.api.model;

/**
 * Reservation category used by government scheme calculations.
 */
public enum StateCategory {
    GENERAL,
    OBC,
    SC,
    ST,
    MINORITY
}

package com.nosota.scholarship.api.model;

/**
 * Formula used by the amount calculation engine.
 */
public enum CalculationStrategy {
    /**
     * base × CGPA multiplier × course level multiplier.
     */
    STANDARD,

    /**
     * base × family income multiplier × course level adjustment.
     */
    NEED_BASED,

    /**
     * base × merit multiplier × scholarship type bonus.
     */
    MERIT_BASED,

    /**
     * Fixed scheme amount by course level × category multiplier × location multiplier.
     * The requested amount is ignored.
     */
    GOVERNMENT_SCHEME,

    /**
     * base × product of caller multipliers + sum of caller adjustments, floored at zero.
     */
    CUSTOM
}

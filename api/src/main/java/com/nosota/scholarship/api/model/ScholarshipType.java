package com.nosota.scholarship.api.model;

/**
 * Category of the scholarship the student applied for.
 */
public enum ScholarshipType {
    MERIT,
    NEED,
    MINORITY,
    SPORTS,
    ARTS,
    RESEARCH,
    DISABILITY,
    FIRST_GENERATION,
    GIRL_CHILD,
    RURAL,
    OTHER
}

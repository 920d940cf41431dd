package com.nosota.scholarship.dto;

/**
 * Stage decisions replayed from the log, and whether they match the ones stored on the application.
 */
public record ReplayedDecisions(
        String applicationId,
        StageDecisions decisions,
        boolean consistent
) {
}

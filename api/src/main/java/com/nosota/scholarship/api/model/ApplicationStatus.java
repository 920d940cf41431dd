package com.nosota.scholarship.api.model;

/**
 * Lifecycle status of a scholarship application.
 *
 * <p>Allowed transitions are owned by the service-side state machine; this enum
 * only names the states.
 */
public enum ApplicationStatus {
    /**
     * DRAFT: Created by the applicant, not yet visible to reviewers.
     */
    DRAFT,

    /**
     * SUBMITTED: Handed in by the applicant, waiting for the institute to pick it up.
     */
    SUBMITTED,

    /**
     * UNDER_REVIEW: Institute review in progress.
     */
    UNDER_REVIEW,

    /**
     * DOCUMENT_VERIFICATION: Institute asked for (or is checking) supporting documents.
     */
    DOCUMENT_VERIFICATION,

    /**
     * ELIGIBILITY_CHECK: Institute is verifying eligibility criteria.
     */
    ELIGIBILITY_CHECK,

    /**
     * APPROVED: Institute approved the full requested amount.
     * Department review and finance forwarding happen while in this status.
     */
    APPROVED,

    /**
     * PARTIALLY_APPROVED: Institute approved less than the requested amount.
     */
    PARTIALLY_APPROVED,

    /**
     * REJECTED: Rejected by the institute or the department. Final state.
     */
    REJECTED,

    /**
     * ON_HOLD: Review paused by the institute.
     */
    ON_HOLD,

    /**
     * CANCELLED: Withdrawn. Final state.
     */
    CANCELLED,

    /**
     * DISBURSED: Funds transferred to the student.
     */
    DISBURSED,

    /**
     * COMPLETED: Disbursement confirmed and the application closed. Final state.
     */
    COMPLETED
}

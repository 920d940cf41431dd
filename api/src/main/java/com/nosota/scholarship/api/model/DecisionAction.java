package com.nosota.scholarship.api.model;

/**
 * Action recorded in the decision log.
 */
public enum DecisionAction {
    SUBMIT,
    START_REVIEW,
    REQUEST_DOCUMENTS,
    START_ELIGIBILITY_CHECK,
    APPROVE,
    PARTIALLY_APPROVE,
    REJECT,
    HOLD,
    DEPT_APPROVE,
    DEPT_REJECT,
    FORWARD_TO_FINANCE,
    DISBURSEMENT_CREATED,
    BANK_DETAILS_UPDATED,
    TRANSFER_SUCCEEDED,
    TRANSFER_FAILED,
    MANUAL_PAYMENT_RECORDED,
    COMPONENT_PAYMENT_RECORDED,
    DISBURSEMENT_CANCELLED,
    COMPLETE
}

package com.nosota.scholarship.api.model;

/**
 * Status of a disbursement.
 *
 * <pre>
 * PENDING → PROCESSING → DISBURSED
 *                      ↘ FAILED → PROCESSING (manual retry)
 * PENDING / FAILED → CANCELLED
 * </pre>
 */
public enum DisbursementStatus {
    /**
     * PENDING: Created, no transfer attempted yet.
     */
    PENDING,

    /**
     * PROCESSING: Transfer handed to the gateway, outcome not yet recorded.
     */
    PROCESSING,

    /**
     * DISBURSED: Funds transferred. Final state, the record is immutable.
     */
    DISBURSED,

    /**
     * FAILED: Gateway reported a failure. Can be retried manually, never automatically.
     */
    FAILED,

    /**
     * CANCELLED: Withdrawn by finance. Final state, the record is immutable.
     */
    CANCELLED;

    public boolean isFinal() {
        return this == DISBURSED || this == CANCELLED;
    }
}

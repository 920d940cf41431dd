package com.nosota.scholarship.api.model;

/**
 * How the scholarship amount reaches the student.
 *
 * <p>Only {@link #BANK_TRANSFER} goes through the funds transfer gateway. The other
 * methods are settled outside the system and confirmed manually.
 */
public enum DisbursementMethod {
    BANK_TRANSFER,
    CHEQUE,
    CASH,
    FEE_ADJUSTMENT;

    public boolean usesTransferGateway() {
        return this == BANK_TRANSFER;
    }
}

package com.nosota.scholarship.error;

/**
 * A bank transfer was requested for a disbursement without account number or IFSC.
 * Nothing is changed; finance has to add the details and try again.
 */
public class IncompleteBankDetailsException extends IllegalStateException implements ErrorCoded {

    public static final String CODE = "INCOMPLETE_BANK_DETAILS";

    public IncompleteBankDetailsException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}

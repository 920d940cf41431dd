package com.nosota.scholarship.error;

/**
 * The application already has a non-cancelled disbursement.
 */
public class AlreadyDisbursedException extends IllegalStateException implements ErrorCoded {

    public static final String CODE = "ALREADY_DISBURSED";

    public AlreadyDisbursedException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}

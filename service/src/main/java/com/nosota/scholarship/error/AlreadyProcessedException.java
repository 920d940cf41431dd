package com.nosota.scholarship.error;

/**
 * The stage decision this operation would record has already been made.
 */
public class AlreadyProcessedException extends IllegalStateException implements ErrorCoded {

    public static final String CODE = "ALREADY_PROCESSED";

    public AlreadyProcessedException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}

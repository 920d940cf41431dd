package com.nosota.scholarship.error;

/**
 * The application does not meet the entry preconditions of the requested stage.
 */
public class NotEligibleException extends IllegalStateException implements ErrorCoded {

    public static final String CODE = "NOT_ELIGIBLE";

    public NotEligibleException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}

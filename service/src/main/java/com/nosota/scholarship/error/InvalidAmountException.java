package com.nosota.scholarship.error;

/**
 * Amount outside the allowed range, e.g. an approval above the requested amount.
 */
public class InvalidAmountException extends IllegalArgumentException implements ErrorCoded {

    public static final String CODE = "INVALID_AMOUNT";

    public InvalidAmountException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}

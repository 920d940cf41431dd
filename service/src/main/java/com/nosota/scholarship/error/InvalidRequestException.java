package com.nosota.scholarship.error;

public class InvalidRequestException extends IllegalArgumentException implements ErrorCoded {

    public static final String CODE = "INVALID_REQUEST";

    public InvalidRequestException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}

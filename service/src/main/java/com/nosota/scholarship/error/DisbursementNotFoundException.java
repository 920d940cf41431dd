package com.nosota.scholarship.error;

import jakarta.persistence.EntityNotFoundException;

public class DisbursementNotFoundException extends EntityNotFoundException implements ErrorCoded {

    public static final String CODE = "DISBURSEMENT_NOT_FOUND";

    public DisbursementNotFoundException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}

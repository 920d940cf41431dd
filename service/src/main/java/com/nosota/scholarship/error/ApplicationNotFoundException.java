package com.nosota.scholarship.error;

import jakarta.persistence.EntityNotFoundException;

public class ApplicationNotFoundException extends EntityNotFoundException implements ErrorCoded {

    public static final String CODE = "APPLICATION_NOT_FOUND";

    public ApplicationNotFoundException(String applicationId) {
        super("Application not found: " + applicationId);
    }

    @Override
    public String getCode() {
        return CODE;
    }
}

package com.nosota.scholarship.security;

public enum Capability {
    INSTITUTE_REVIEW,
    DEPARTMENT_REVIEW,
    FORWARD_TO_FINANCE,
    CALCULATE_AMOUNT,
    DISBURSE
}

package com.nosota.scholarship.api.model;

/**
 * Role of the staff member calling the engine.
 */
public enum StaffRole {
    INSTITUTE_ADMIN,
    DEPARTMENT_ADMIN,
    FINANCE_ADMIN
}

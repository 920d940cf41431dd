package com.nosota.scholarship.api.model;

/**
 * Department reviewer actions.
 */
public enum DepartmentAction {
    DEPT_APPROVE,
    DEPT_REJECT
}

package com.nosota.scholarship.security;

import com.nosota.scholarship.api.model.StaffRole;

/**
 * Staff member performing an operation, as identified by the actor headers.
 *
 * @param id    Staff ID recorded in decisions and the decision log
 * @param role  Staff role
 * @param scope Institute ID (institute admin), department ID (department admin) or
 *              institute ID / null for all institutes (finance admin)
 */
public record Actor(String id, StaffRole role, Long scope) {

    public static Actor of(String id, StaffRole role, Long scope) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Actor ID is required");
        }
        if (role == null) {
            throw new IllegalArgumentException("Actor role is required");
        }
        return new Actor(id, role, scope);
    }
}

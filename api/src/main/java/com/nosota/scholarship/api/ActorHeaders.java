package com.nosota.scholarship.api;

/**
 * Request headers identifying the staff member (or student) behind a call.
 *
 * <p>Authentication happens upstream; the engine trusts these headers and only
 * checks what the identified actor is allowed to do.
 */
public final class ActorHeaders {

    public static final String ACTOR_ID = "X-Actor-Id";

    /** One of {@link com.nosota.scholarship.api.model.StaffRole}. */
    public static final String ACTOR_ROLE = "X-Actor-Role";

    /** Institute ID for institute admins, department ID for department admins, absent for finance. */
    public static final String ACTOR_SCOPE = "X-Actor-Scope";

    public static final String CORRELATION_ID = "X-Correlation-Id";

    private ActorHeaders() {
    }
}

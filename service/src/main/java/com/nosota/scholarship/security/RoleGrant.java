package com.nosota.scholarship.security;

import com.nosota.scholarship.model.Application;

import java.util.Set;

/**
 * What one staff role may do and which applications it may do it to.
 */
interface RoleGrant {

    Set<Capability> capabilities();

    /**
     * @return true if the actor's scope includes the application
     */
    boolean covers(Actor actor, Application application);
}

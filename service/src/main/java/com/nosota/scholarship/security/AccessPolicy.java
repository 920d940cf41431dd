package com.nosota.scholarship.security;

import com.nosota.scholarship.api.model.StaffRole;
import com.nosota.scholarship.model.Application;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Single capability check used by every gatekeeper.
 *
 * <ul>
 *   <li>INSTITUTE_ADMIN: institute review, applications of the institute in its scope</li>
 *   <li>DEPARTMENT_ADMIN: department review and forwarding, applications of its department</li>
 *   <li>FINANCE_ADMIN: calculation and disbursement, all institutes or the one in its scope</li>
 * </ul>
 */
@Component
@Slf4j
public class AccessPolicy {

    private static final Map<StaffRole, RoleGrant> GRANTS = new EnumMap<>(StaffRole.class);

    static {
        GRANTS.put(StaffRole.INSTITUTE_ADMIN, new InstituteAdminGrant());
        GRANTS.put(StaffRole.DEPARTMENT_ADMIN, new DepartmentAdminGrant());
        GRANTS.put(StaffRole.FINANCE_ADMIN, new FinanceAdminGrant());
    }

    /**
     * Checks that the actor's role carries the capability.
     *
     * @throws AccessDeniedException if it does not
     */
    public void check(Actor actor, Capability capability) {
        if (!grantOf(actor).capabilities().contains(capability)) {
            log.warn("Access denied: actor={}, role={}, capability={}", actor.id(), actor.role(), capability);
            throw new AccessDeniedException(String.format("Role %s may not perform %s", actor.role(), capability));
        }
    }

    /**
     * Checks the capability and that the application is inside the actor's scope.
     *
     * @throws AccessDeniedException if either check fails
     */
    public void check(Actor actor, Capability capability, Application application) {
        check(actor, capability);
        if (!grantOf(actor).covers(actor, application)) {
            log.warn("Access denied: actor={}, role={}, scope={}, applicationId={}",
                    actor.id(), actor.role(), actor.scope(), application.getApplicationId());
            throw new AccessDeniedException(String.format("Application %s is outside the scope of %s %s",
                    application.getApplicationId(), actor.role(), actor.id()));
        }
    }

    public boolean isAllowed(Actor actor, Capability capability, Application application) {
        RoleGrant grant = grantOf(actor);
        return grant.capabilities().contains(capability) && grant.covers(actor, application);
    }

    private static RoleGrant grantOf(Actor actor) {
        RoleGrant grant = GRANTS.get(actor.role());
        if (grant == null) {
            throw new AccessDeniedException("Unknown role: " + actor.role());
        }
        return grant;
    }

    static class InstituteAdminGrant implements RoleGrant {

        @Override
        public Set<Capability> capabilities() {
            return EnumSet.of(Capability.INSTITUTE_REVIEW);
        }

        @Override
        public boolean covers(Actor actor, Application application) {
            return actor.scope() != null && Objects.equals(actor.scope(), application.getInstituteId());
        }
    }

    static class DepartmentAdminGrant implements RoleGrant {

        @Override
        public Set<Capability> capabilities() {
            return EnumSet.of(Capability.DEPARTMENT_REVIEW, Capability.FORWARD_TO_FINANCE);
        }

        @Override
        public boolean covers(Actor actor, Application application) {
            return actor.scope() != null && Objects.equals(actor.scope(), application.getDepartmentId());
        }
    }

    static class FinanceAdminGrant implements RoleGrant {

        @Override
        public Set<Capability> capabilities() {
            return EnumSet.of(Capability.CALCULATE_AMOUNT, Capability.DISBURSE);
        }

        @Override
        public boolean covers(Actor actor, Application application) {
            return actor.scope() == null || Objects.equals(actor.scope(), application.getInstituteId());
        }
    }
}

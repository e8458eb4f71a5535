package com.buildflow.security.rbac;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Roles a route accepts.
 *
 * @param allowedRoles accepted roles, never empty
 * @param allowHigherRoles also accept any role that outranks an allowed one
 */
public record RoleRequirement(Set<Role> allowedRoles, boolean allowHigherRoles) {

    public RoleRequirement {
        if (allowedRoles == null || allowedRoles.isEmpty()) {
            throw new IllegalArgumentException("allowedRoles must not be empty");
        }
        if (allowedRoles.contains(Role.UNRECOGNIZED)) {
            throw new IllegalArgumentException("UNRECOGNIZED cannot be required");
        }
        allowedRoles = Set.copyOf(EnumSet.copyOf(allowedRoles));
    }

    /** Accepts the given roles and anything above them. */
    public static RoleRequirement atLeast(Role first, Role... more) {
        return new RoleRequirement(EnumSet.of(first, more), true);
    }

    /** Accepts only the given roles. */
    public static RoleRequirement exactly(Role first, Role... more) {
        return new RoleRequirement(EnumSet.of(first, more), false);
    }

    public RoleScope scope() {
        return RoleScope.forRequirement(allowedRoles);
    }

    public boolean isSatisfiedBy(Role effectiveRole) {
        if (allowedRoles.contains(effectiveRole)) {
            return true;
        }
        return allowHigherRoles && allowedRoles.stream().anyMatch(effectiveRole::outranksOrEquals);
    }

    @Override
    public String toString() {
        return Arrays.toString(allowedRoles.stream().map(Role::value).sorted().toArray())
                + (allowHigherRoles ? " or higher" : "");
    }
}

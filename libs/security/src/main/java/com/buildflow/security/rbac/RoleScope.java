package com.buildflow.security.rbac;

import java.util.Collection;

/** Which database a role lookup reads from. */
public enum RoleScope {
    /** System-level roles in the main database. */
    MAIN,
    /** Tenant roles in the caller's agency database. */
    AGENCY;

    /** Requirements naming any system role are checked at system level. */
    public static RoleScope forRequirement(Collection<Role> allowedRoles) {
        return allowedRoles.stream().anyMatch(Role::isSystemRole) ? MAIN : AGENCY;
    }
}

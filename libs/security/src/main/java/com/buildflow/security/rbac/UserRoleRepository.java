package com.buildflow.security.rbac;

import java.util.List;

/** Reads the roles a user holds in one {@link RoleScope}. */
public interface UserRoleRepository {

    RoleScope scope();

    /**
     * @param userId user identifier
     * @param agencyDatabase caller's agency database; required for {@link RoleScope#AGENCY}
     * @return roles of the user, {@link Role#UNRECOGNIZED} for stored names that are not platform
     *     roles, empty when there are none or the user id cannot be stored
     */
    List<Role> findRoles(String userId, String agencyDatabase);
}

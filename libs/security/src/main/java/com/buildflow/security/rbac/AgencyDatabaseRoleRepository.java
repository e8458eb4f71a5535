package com.buildflow.security.rbac;

import com.buildflow.database.pool.TenantPoolManager;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Tenant roles from the caller's agency database. */
public class AgencyDatabaseRoleRepository implements UserRoleRepository {

    private static final Logger log = LoggerFactory.getLogger(AgencyDatabaseRoleRepository.class);

    static final String ROLES_SQL = "SELECT role FROM public.user_roles WHERE user_id = CAST(? AS uuid)";

    private final TenantPoolManager poolManager;

    public AgencyDatabaseRoleRepository(TenantPoolManager poolManager) {
        this.poolManager = poolManager;
    }

    @Override
    public RoleScope scope() {
        return RoleScope.AGENCY;
    }

    @Override
    public List<Role> findRoles(String userId, String agencyDatabase) {
        if (agencyDatabase == null) {
            throw new IllegalArgumentException("agencyDatabase is required for agency roles");
        }
        if (!RoleNames.isStoredUserId(userId)) {
            log.debug("User id {} is not a uuid, no roles in {}", userId, agencyDatabase);
            return List.of();
        }
        List<String> names =
                poolManager
                        .getAgencyPool(agencyDatabase)
                        .execute(jdbc -> jdbc.queryForList(ROLES_SQL, String.class, userId));
        return RoleNames.toRoles(names, userId, agencyDatabase);
    }
}

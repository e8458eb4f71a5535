package com.buildflow.security.rbac;

import com.buildflow.database.error.DatabaseErrorKind;
import com.buildflow.database.error.TenantDatabaseException;
import com.buildflow.database.pool.DatabasePool;
import com.buildflow.database.pool.TenantPoolManager;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * System-level roles from the main database.
 *
 * <p>Older main databases have no {@code user_roles} table; for those the single
 * {@code users.role} column is read instead.
 */
public class MainDatabaseRoleRepository implements UserRoleRepository {

    private static final Logger log = LoggerFactory.getLogger(MainDatabaseRoleRepository.class);

    static final String ROLES_SQL = "SELECT role FROM public.user_roles WHERE user_id = CAST(? AS uuid)";
    static final String LEGACY_ROLE_SQL =
            "SELECT role FROM public.users WHERE id = CAST(? AS uuid) AND role IS NOT NULL";

    private final TenantPoolManager poolManager;

    public MainDatabaseRoleRepository(TenantPoolManager poolManager) {
        this.poolManager = poolManager;
    }

    @Override
    public RoleScope scope() {
        return RoleScope.MAIN;
    }

    @Override
    public List<Role> findRoles(String userId, String agencyDatabase) {
        if (!RoleNames.isStoredUserId(userId)) {
            log.debug("User id {} is not a uuid, no main database roles", userId);
            return List.of();
        }
        DatabasePool main = poolManager.getMainPool();
        List<String> names;
        try {
            names = main.execute(jdbc -> jdbc.queryForList(ROLES_SQL, String.class, userId));
        } catch (TenantDatabaseException e) {
            if (e.kind() != DatabaseErrorKind.SCHEMA_MISMATCH) {
                throw e;
            }
            log.debug("No user_roles table in {}, reading users.role", main.databaseName());
            names = main.execute(jdbc -> jdbc.queryForList(LEGACY_ROLE_SQL, String.class, userId));
        }
        return RoleNames.toRoles(names, userId, main.databaseName());
    }
}

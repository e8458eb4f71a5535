package com.buildflow.security.rbac;

import com.buildflow.security.AuthenticatedUser;
import com.buildflow.security.ErrorCode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a user's roles satisfy a route's {@link RoleRequirement}.
 *
 * <p>Requirements that name a system role are checked against the main database first; when the
 * user has no system roles there, the agency database bound to the session is consulted. All
 * other requirements are checked against the agency database only. The user's effective role is
 * the one with the lowest rank among the roles found.
 *
 * <p>Every denial is logged at WARN with the actor, the required roles and the request line.
 */
public class RbacAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(RbacAuthorizer.class);

    private final Map<RoleScope, UserRoleRepository> repositories = new EnumMap<>(RoleScope.class);

    public RbacAuthorizer(List<UserRoleRepository> repositories) {
        for (UserRoleRepository repository : repositories) {
            this.repositories.put(repository.scope(), repository);
        }
        for (RoleScope scope : RoleScope.values()) {
            if (!this.repositories.containsKey(scope)) {
                throw new IllegalArgumentException("No role repository for scope " + scope);
            }
        }
    }

    public AuthorizationDecision authorize(
            AuthenticatedUser user, RoleRequirement requirement, String method, String path) {
        RoleScope scope = requirement.scope();
        List<Role> roles;
        if (scope == RoleScope.MAIN) {
            ScopedRoles system = systemRoles(user);
            scope = system.scope();
            roles = system.roles();
        } else {
            if (!user.hasAgencyContext()) {
                return denied(
                        AuthorizationDecision.deny(ErrorCode.RBAC_NO_AGENCY_CONTEXT, null, List.of(), null),
                        user,
                        requirement,
                        method,
                        path);
            }
            roles = rolesOf(user, RoleScope.AGENCY);
        }

        if (roles.isEmpty()) {
            return denied(
                    AuthorizationDecision.deny(ErrorCode.RBAC_NO_ROLES, scope, roles, null),
                    user,
                    requirement,
                    method,
                    path);
        }

        Role effective = Role.effective(roles).orElseThrow();
        if (requirement.isSatisfiedBy(effective)) {
            log.debug("Granted {} {} to user {} as {}", method, path, user.userId(), effective.value());
            return AuthorizationDecision.grant(scope, roles, effective);
        }
        return denied(
                AuthorizationDecision.deny(
                        ErrorCode.RBAC_FORBIDDEN,
                        ErrorCode.RBAC_FORBIDDEN.defaultMessage(),
                        scope,
                        roles,
                        effective,
                        Map.of(
                                "requiredRoles",
                                requirement.allowedRoles().stream().map(Role::value).sorted().toList(),
                                "userRole",
                                effective.value())),
                user,
                requirement,
                method,
                path);
    }

    /**
     * Grants only users whose effective role is {@link Role#SUPER_ADMIN}, read from the main
     * database first and from the session's agency database when the main database has none.
     */
    public AuthorizationDecision requireSuperAdmin(AuthenticatedUser user, String method, String path) {
        ScopedRoles system = systemRoles(user);
        Role effective = Role.effective(system.roles()).orElse(null);
        if (effective == Role.SUPER_ADMIN) {
            return AuthorizationDecision.grant(system.scope(), system.roles(), effective);
        }
        return denied(
                AuthorizationDecision.deny(
                        ErrorCode.RBAC_INSUFFICIENT_ROLE, system.scope(), system.roles(), effective),
                user,
                RoleRequirement.exactly(Role.SUPER_ADMIN),
                method,
                path);
    }

    /** Roles of the user in one scope; an agency lookup needs the session's agency database. */
    public List<Role> rolesOf(AuthenticatedUser user, RoleScope scope) {
        return repositories.get(scope).findRoles(user.userId(), user.agencyDatabase());
    }

    private ScopedRoles systemRoles(AuthenticatedUser user) {
        List<Role> roles = rolesOf(user, RoleScope.MAIN);
        if (roles.isEmpty() && user.hasAgencyContext()) {
            return new ScopedRoles(RoleScope.AGENCY, rolesOf(user, RoleScope.AGENCY));
        }
        return new ScopedRoles(RoleScope.MAIN, roles);
    }

    private record ScopedRoles(RoleScope scope, List<Role> roles) {}

    private AuthorizationDecision denied(
            AuthorizationDecision decision,
            AuthenticatedUser user,
            RoleRequirement requirement,
            String method,
            String path) {
        log.warn(
                "Access denied [{}]: user={} agencyDatabase={} required={} effectiveRole={} request={} {}",
                decision.errorCode(),
                user.userId(),
                user.agencyDatabase(),
                requirement,
                decision.effectiveRole() != null ? decision.effectiveRole().value() : "none",
                method,
                path);
        return decision;
    }
}

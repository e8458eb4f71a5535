package com.buildflow.security.rbac;

import com.buildflow.security.AuthorizationException;
import com.buildflow.security.ErrorCode;
import java.util.List;
import java.util.Map;

/**
 * Outcome of an RBAC check.
 *
 * @param granted whether the request may proceed
 * @param errorCode reason for a denial, null when granted
 * @param message client-facing message for a denial
 * @param scope database the roles were read from, null when no lookup happened
 * @param roles roles found for the user
 * @param effectiveRole highest-authority role, null when the user has none
 * @param details extra client-facing context for a denial
 */
public record AuthorizationDecision(
        boolean granted,
        ErrorCode errorCode,
        String message,
        RoleScope scope,
        List<Role> roles,
        Role effectiveRole,
        Map<String, Object> details) {

    public AuthorizationDecision {
        roles = roles == null ? List.of() : List.copyOf(roles);
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    static AuthorizationDecision grant(RoleScope scope, List<Role> roles, Role effectiveRole) {
        return new AuthorizationDecision(true, null, null, scope, roles, effectiveRole, Map.of());
    }

    static AuthorizationDecision deny(ErrorCode code, RoleScope scope, List<Role> roles, Role effective) {
        return deny(code, code.defaultMessage(), scope, roles, effective, Map.of());
    }

    static AuthorizationDecision deny(
            ErrorCode code,
            String message,
            RoleScope scope,
            List<Role> roles,
            Role effectiveRole,
            Map<String, Object> details) {
        return new AuthorizationDecision(false, code, message, scope, roles, effectiveRole, details);
    }

    /** Returns this decision if granted, otherwise throws the matching {@link AuthorizationException}. */
    public AuthorizationDecision orElseThrow() {
        if (!granted) {
            throw new AuthorizationException(errorCode, message, details);
        }
        return this;
    }
}

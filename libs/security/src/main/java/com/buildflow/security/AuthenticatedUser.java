package com.buildflow.security;

import com.buildflow.security.token.SessionClaims;

/**
 * The caller of a request, built from a verified session token.
 *
 * @param userId user identifier, also the token subject
 * @param email user's email address
 * @param agencyId agency the session was issued for, null for system users
 * @param agencyDatabase resolved agency database name, null when the session has no agency scope
 */
public record AuthenticatedUser(String userId, String email, String agencyId, String agencyDatabase) {

    public static AuthenticatedUser of(SessionClaims claims, String resolvedAgencyDatabase) {
        return new AuthenticatedUser(
                claims.userId(), claims.email(), claims.agencyId(), resolvedAgencyDatabase);
    }

    public boolean hasAgencyContext() {
        return agencyDatabase != null;
    }
}

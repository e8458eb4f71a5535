package com.buildflow.security.token;

/**
 * Identity carried by a session token.
 *
 * @param userId user identifier, required
 * @param email user's email, required
 * @param agencyId agency the session belongs to, null for system users
 * @param agencyDatabase agency database bound to the session, null when unknown at issue time
 */
public record SessionClaims(String userId, String email, String agencyId, String agencyDatabase) {

    public static SessionClaims system(String userId, String email) {
        return new SessionClaims(userId, email, null, null);
    }
}

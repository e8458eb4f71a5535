package com.buildflow.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds a request to the agency database of its session token.
 *
 * <p>The {@code X-Agency-Database} header may only repeat the token's database; it can never
 * switch a session to another tenant.
 */
public final class AgencyContextEnforcer {

    public static final String AGENCY_DATABASE_HEADER = "X-Agency-Database";

    private static final Logger log = LoggerFactory.getLogger(AgencyContextEnforcer.class);

    private AgencyContextEnforcer() {
        // utility class
    }

    /**
     * @param user authenticated caller
     * @param requestedDatabase value of the agency database header, null when absent
     * @return the agency database the request is bound to
     * @throws AuthorizationException with {@link ErrorCode#RBAC_NO_AGENCY_CONTEXT} when the session
     *     has no agency database
     * @throws AgencyMismatchException when the header names another database
     */
    public static String enforce(AuthenticatedUser user, String requestedDatabase) {
        if (!user.hasAgencyContext()) {
            throw new AuthorizationException(
                    ErrorCode.RBAC_NO_AGENCY_CONTEXT, ErrorCode.RBAC_NO_AGENCY_CONTEXT.defaultMessage());
        }
        if (requestedDatabase != null && !requestedDatabase.isBlank()) {
            String requested = requestedDatabase.strip();
            if (!requested.equals(user.agencyDatabase())) {
                log.warn(
                        "Agency mismatch for user {}: token database {}, requested {}",
                        user.userId(),
                        user.agencyDatabase(),
                        requested);
                throw new AgencyMismatchException(user.agencyDatabase(), requested);
            }
        }
        return user.agencyDatabase();
    }
}

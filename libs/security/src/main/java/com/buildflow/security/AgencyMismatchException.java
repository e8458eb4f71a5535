package com.buildflow.security;

import java.util.Map;

/**
 * Thrown when a request names an agency database other than the one bound to its session token.
 */
public class AgencyMismatchException extends AuthorizationException {

    private final String tokenDatabase;
    private final String requestedDatabase;

    public AgencyMismatchException(String tokenDatabase, String requestedDatabase) {
        super(
                ErrorCode.RBAC_AGENCY_MISMATCH,
                ErrorCode.RBAC_AGENCY_MISMATCH.defaultMessage(),
                Map.of("requestedDatabase", requestedDatabase));
        this.tokenDatabase = tokenDatabase;
        this.requestedDatabase = requestedDatabase;
    }

    public String tokenDatabase() {
        return tokenDatabase;
    }

    public String requestedDatabase() {
        return requestedDatabase;
    }
}

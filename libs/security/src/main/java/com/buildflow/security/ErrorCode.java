package com.buildflow.security;

import com.buildflow.database.error.DatabaseErrorKind;

/**
 * Stable error codes returned to API clients, each bound to the HTTP status it is served with.
 *
 * <p>Codes are part of the public contract; clients branch on them, so existing values are never
 * renamed.
 */
public enum ErrorCode {

    AUTH_MISSING_TOKEN(401, "Authentication token is required"),
    AUTH_INVALID_TOKEN(401, "Invalid or expired token"),

    RBAC_NO_AGENCY_CONTEXT(403, "Agency context is required"),
    RBAC_AGENCY_MISMATCH(403, "Requested agency does not match the authenticated agency"),
    RBAC_NO_ROLES(403, "User has no roles assigned"),
    RBAC_FORBIDDEN(403, "Insufficient permissions"),
    RBAC_INSUFFICIENT_ROLE(403, "Super admin access required"),

    AGENCY_NOT_FOUND(404, "Agency not found"),
    AGENCY_DATABASE_NOT_FOUND(404, "Agency database not found"),
    VALIDATION_FAILED(400, "Request validation failed"),
    ROUTE_NOT_FOUND(404, "Route not found"),
    METHOD_NOT_ALLOWED(405, "Method not allowed"),
    DB_CONFLICT(409, "Resource already exists"),
    RATE_LIMITED(429, "Too many requests, please try again later"),

    DB_SCHEMA_MISMATCH(500, "Database schema is out of date"),
    DB_ERROR(500, "Database error"),
    INTERNAL_ERROR(500, "Internal server error"),

    DB_POOL_EXHAUSTED(503, "Database is busy, please retry"),
    DB_UNAVAILABLE(503, "Database is temporarily unavailable");

    private final int httpStatus;
    private final String defaultMessage;

    ErrorCode(int httpStatus, String defaultMessage) {
        this.httpStatus = httpStatus;
        this.defaultMessage = defaultMessage;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    /** Maps a classified database failure to the code served to clients. */
    public static ErrorCode forDatabaseError(DatabaseErrorKind kind) {
        return switch (kind) {
            case TENANT_NOT_FOUND -> AGENCY_DATABASE_NOT_FOUND;
            case SCHEMA_MISMATCH -> DB_SCHEMA_MISMATCH;
            case POOL_EXHAUSTED -> DB_POOL_EXHAUSTED;
            case TRANSIENT_FAILURE -> DB_UNAVAILABLE;
            case CONSTRAINT_VIOLATION -> DB_CONFLICT;
            case UNKNOWN -> DB_ERROR;
        };
    }
}

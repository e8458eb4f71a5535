package com.buildflow.database.error;

/**
 * Closed set of data-access failure kinds. Upper layers switch on these instead of inspecting
 * driver error codes or messages.
 */
public enum DatabaseErrorKind {

    /** The target database does not exist (agency deprovisioned or misrouted). */
    TENANT_NOT_FOUND,

    /** A table, column, function or type is missing: the schema is older than the code. */
    SCHEMA_MISMATCH,

    /** Connection refused or dropped, server shutting down, statement cancelled. Retryable. */
    TRANSIENT_FAILURE,

    /** No connection could be checked out of the pool within the acquisition timeout. */
    POOL_EXHAUSTED,

    /** Unique, foreign-key, not-null or check constraint violated. */
    CONSTRAINT_VIOLATION,

    UNKNOWN
}

package com.buildflow.database.error;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Maps a data-access failure to a {@link DatabaseErrorKind} by walking its cause chain for the
 * first {@link SQLException} and reading its SQLState.
 *
 * <p>Spring's {@code DataAccessException} hierarchy wraps the driver exception as its cause, so
 * passing the Spring exception directly works.
 */
public final class DatabaseErrorClassifier {

    /** invalid_catalog_name */
    public static final String DATABASE_DOES_NOT_EXIST = "3D000";

    private static final Set<String> SCHEMA_MISMATCH_STATES =
            Set.of(
                    "42P01", // undefined_table
                    "42703", // undefined_column
                    "42883", // undefined_function
                    "42704" // undefined_object
                    );

    private static final Set<String> TRANSIENT_STATES =
            Set.of(
                    "57P01", // admin_shutdown
                    "57P02", // crash_shutdown
                    "57P03", // cannot_connect_now
                    "53300", // too_many_connections
                    "57014" // query_canceled (statement timeout)
                    );

    private static final int MAX_CAUSE_DEPTH = 16;

    private DatabaseErrorClassifier() {
        // utility class
    }

    public static DatabaseErrorKind classify(Throwable error) {
        if (error == null) {
            return DatabaseErrorKind.UNKNOWN;
        }
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof SQLException sql) {
                return classifySqlException(sql);
            }
            current = current.getCause();
        }
        return DatabaseErrorKind.UNKNOWN;
    }

    static DatabaseErrorKind classifySqlException(SQLException error) {
        DatabaseErrorKind fromState = classifyState(firstSqlState(error));
        if (fromState != null) {
            return fromState;
        }
        // Hikari raises this on acquisition timeout and attaches the last connection failure, if any
        if (error instanceof SQLTransientConnectionException) {
            return hasUnderlyingFailure(error)
                    ? DatabaseErrorKind.TRANSIENT_FAILURE
                    : DatabaseErrorKind.POOL_EXHAUSTED;
        }
        if (error instanceof SQLTransientException) {
            return DatabaseErrorKind.TRANSIENT_FAILURE;
        }
        return DatabaseErrorKind.UNKNOWN;
    }

    /** SQLState of {@code error}, else of its next exception, else of the first SQL cause carrying one. */
    private static String firstSqlState(SQLException error) {
        if (error.getSQLState() != null) {
            return error.getSQLState();
        }
        SQLException next = error.getNextException();
        if (next != null && next != error && next.getSQLState() != null) {
            return next.getSQLState();
        }
        Throwable current = error.getCause();
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof SQLException sql && sql.getSQLState() != null) {
                return sql.getSQLState();
            }
            current = current.getCause();
        }
        return null;
    }

    private static DatabaseErrorKind classifyState(String state) {
        if (state == null) {
            return null;
        }
        if (DATABASE_DOES_NOT_EXIST.equals(state)) {
            return DatabaseErrorKind.TENANT_NOT_FOUND;
        }
        if (SCHEMA_MISMATCH_STATES.contains(state)) {
            return DatabaseErrorKind.SCHEMA_MISMATCH;
        }
        if (state.startsWith("08") || TRANSIENT_STATES.contains(state)) {
            return DatabaseErrorKind.TRANSIENT_FAILURE;
        }
        if (state.startsWith("23")) {
            return DatabaseErrorKind.CONSTRAINT_VIOLATION;
        }
        return null;
    }

    private static boolean hasUnderlyingFailure(SQLException error) {
        return error.getSQLState() != null
                || error.getNextException() != null
                || error.getCause() != null;
    }
}

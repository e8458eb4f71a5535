package com.buildflow.database.error;

/**
 * A classified failure raised at the data-access boundary.
 *
 * <p>Carries the {@link DatabaseErrorKind} and the database the statement was routed to, so the
 * web layer can pick a status code without looking at the driver exception.
 */
public class TenantDatabaseException extends RuntimeException {

    private final DatabaseErrorKind kind;
    private final String databaseName;

    public TenantDatabaseException(DatabaseErrorKind kind, String databaseName, Throwable cause) {
        super(kind + " on database " + databaseName, cause);
        this.kind = kind;
        this.databaseName = databaseName;
    }

    public TenantDatabaseException(DatabaseErrorKind kind, String databaseName, String message) {
        super(message);
        this.kind = kind;
        this.databaseName = databaseName;
    }

    public DatabaseErrorKind kind() {
        return kind;
    }

    public String databaseName() {
        return databaseName;
    }

    /**
     * Wraps {@code error} after classifying it. Returns the most specific subtype.
     */
    public static TenantDatabaseException from(Throwable error, String databaseName) {
        DatabaseErrorKind kind = DatabaseErrorClassifier.classify(error);
        if (kind == DatabaseErrorKind.POOL_EXHAUSTED) {
            return new PoolExhaustedException(databaseName, error);
        }
        return new TenantDatabaseException(kind, databaseName, error);
    }
}

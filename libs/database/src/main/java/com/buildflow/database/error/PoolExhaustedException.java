package com.buildflow.database.error;

/** No connection became available within the pool's acquisition timeout. */
public class PoolExhaustedException extends TenantDatabaseException {

    public PoolExhaustedException(String databaseName, Throwable cause) {
        super(DatabaseErrorKind.POOL_EXHAUSTED, databaseName, cause);
    }
}

package com.buildflow.database.pool;

import javax.sql.DataSource;

/**
 * Creates the physical connection pool behind a {@link DatabasePool}.
 *
 * <p>Implementations must not open a connection while creating the pool: a pool for an
 * unreachable database is still created, and the failure surfaces on the first statement.
 */
@FunctionalInterface
public interface PoolFactory {

    DataSource create(PoolSettings settings);
}

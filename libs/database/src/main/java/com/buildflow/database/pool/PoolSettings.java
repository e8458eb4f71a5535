package com.buildflow.database.pool;

import java.time.Duration;

/**
 * Everything a {@link PoolFactory} needs to build one pool.
 *
 * @param poolName name used in logs and metrics, {@code buildflow-main} or {@code agency-<db>}
 * @param databaseName physical database the pool is bound to
 * @param kind main or agency
 * @param jdbcUrl JDBC URL without credentials
 * @param username database user
 * @param password database password
 * @param maxConnections upper bound on open connections
 * @param idleConnectionTimeout idle time after which a connection is retired
 * @param connectionTimeout acquisition timeout
 */
public record PoolSettings(
        String poolName,
        String databaseName,
        PoolKind kind,
        String jdbcUrl,
        String username,
        String password,
        int maxConnections,
        Duration idleConnectionTimeout,
        Duration connectionTimeout) {

    @Override
    public String toString() {
        return "PoolSettings[poolName=" + poolName + ", jdbcUrl=" + jdbcUrl + ", username="
                + username + ", maxConnections=" + maxConnections + "]";
    }
}

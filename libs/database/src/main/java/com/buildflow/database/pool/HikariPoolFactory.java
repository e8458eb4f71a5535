package com.buildflow.database.pool;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;

/** Builds lazily-connecting HikariCP pools. */
public class HikariPoolFactory implements PoolFactory {

    static final String APPLICATION_NAME = "buildflow-api";

    @Override
    public DataSource create(PoolSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setPoolName(settings.poolName());
        config.setJdbcUrl(settings.jdbcUrl());
        config.setUsername(settings.username());
        config.setPassword(settings.password());
        config.setMaximumPoolSize(settings.maxConnections());
        config.setMinimumIdle(0);
        config.setIdleTimeout(settings.idleConnectionTimeout().toMillis());
        config.setConnectionTimeout(settings.connectionTimeout().toMillis());
        // -1: do not try to connect while building the pool
        config.setInitializationFailTimeout(-1);
        config.addDataSourceProperty("ApplicationName", APPLICATION_NAME);
        config.addDataSourceProperty("tcpKeepAlive", "true");
        return new HikariDataSource(config);
    }
}

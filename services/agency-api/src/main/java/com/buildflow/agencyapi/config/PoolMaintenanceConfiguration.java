package com.buildflow.agencyapi.config;

import com.buildflow.database.config.DatabaseProperties;
import com.buildflow.database.pool.TenantPoolManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/** Schedules the idle agency pool sweep every {@code buildflow.database.eviction-interval}. */
@Configuration
public class PoolMaintenanceConfiguration implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(PoolMaintenanceConfiguration.class);

    private final TenantPoolManager poolManager;
    private final DatabaseProperties properties;

    public PoolMaintenanceConfiguration(TenantPoolManager poolManager, DatabaseProperties properties) {
        this.poolManager = poolManager;
        this.properties = properties;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.addFixedDelayTask(this::sweepIdlePools, properties.evictionInterval());
    }

    void sweepIdlePools() {
        int evicted = poolManager.evictIdlePools();
        if (evicted > 0) {
            log.info("Idle sweep closed {} agency pools", evicted);
        }
    }
}

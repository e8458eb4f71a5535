package com.buildflow.agencyapi.health;

import com.buildflow.database.error.TenantDatabaseException;
import com.buildflow.database.pool.PoolManagerStatistics;
import com.buildflow.database.pool.TenantPoolManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Reports {@code UP} when the main database answers {@code SELECT 1}, with pool counts as details.
 * Shows as {@code poolManager} under {@code /actuator/health}.
 */
@Component("poolManagerHealthIndicator")
@ConditionalOnProperty(
        prefix = "management.health.pool-manager",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true)
public class PoolManagerHealthIndicator implements HealthIndicator {

    private final TenantPoolManager poolManager;

    public PoolManagerHealthIndicator(TenantPoolManager poolManager) {
        this.poolManager = poolManager;
    }

    @Override
    public Health health() {
        if (poolManager.isClosed()) {
            return Health.outOfService().withDetail("reason", "pool manager closed").build();
        }
        try {
            poolManager.getMainPool().execute(jdbc -> jdbc.queryForObject("SELECT 1", Integer.class));
        } catch (TenantDatabaseException e) {
            return Health.down()
                    .withDetail("mainDatabase", poolManager.mainDatabaseName())
                    .withDetail("error", e.kind().name())
                    .build();
        }
        PoolManagerStatistics stats = poolManager.statistics();
        return Health.up()
                .withDetail("mainDatabase", poolManager.mainDatabaseName())
                .withDetail("agencyPools", stats.agencyPoolCount())
                .withDetail("maxAgencyPools", stats.maxAgencyPools())
                .withDetail("agencyConnections", stats.totalAgencyConnections())
                .withDetail("utilizationPercent", stats.utilizationPercent())
                .build();
    }
}

package com.buildflow.database.pool;

import java.util.List;

/**
 * Snapshot of every pool owned by a {@link TenantPoolManager}.
 *
 * @param mainPool statistics of the main pool, null until it has been created
 * @param agencyPools statistics of each open agency pool, most recently used first
 * @param maxAgencyPools configured agency pool capacity
 * @param maxConnectionsPerAgencyPool configured connection bound per agency pool
 */
public record PoolManagerStatistics(
        PoolStatistics mainPool,
        List<PoolStatistics> agencyPools,
        int maxAgencyPools,
        int maxConnectionsPerAgencyPool) {

    public PoolManagerStatistics {
        agencyPools = List.copyOf(agencyPools);
    }

    public int agencyPoolCount() {
        return agencyPools.size();
    }

    public int totalAgencyConnections() {
        return agencyPools.stream().mapToInt(PoolStatistics::totalConnections).sum();
    }

    /** Share of agency pool capacity in use, 0 to 100. */
    public int utilizationPercent() {
        return maxAgencyPools == 0 ? 0 : Math.round(agencyPoolCount() * 100f / maxAgencyPools);
    }
}

package com.buildflow.agencyapi.metrics;

import com.buildflow.database.pool.DatabasePool;
import com.buildflow.database.pool.PoolEventListener;
import com.buildflow.database.pool.PoolStatistics;
import com.buildflow.database.pool.TenantPoolManager;
import com.buildflow.observability.MetricFactory;
import java.util.function.ToIntFunction;
import org.springframework.stereotype.Component;

/**
 * Micrometer view of the pool manager: the number of open agency pools, open and close counters,
 * and per-pool connection gauges that are removed when a pool closes.
 */
@Component
public class PoolMetrics implements PoolEventListener {

    static final String AGENCY_POOLS = "buildflow.db.pools.agency";
    static final String POOLS_CREATED = "buildflow.db.pools.created";
    static final String POOLS_CLOSED = "buildflow.db.pools.closed";
    static final String CONNECTIONS_ACTIVE = "buildflow.db.connections.active";
    static final String CONNECTIONS_IDLE = "buildflow.db.connections.idle";
    static final String THREADS_WAITING = "buildflow.db.connections.waiting";

    private final MetricFactory metrics;

    public PoolMetrics(MetricFactory metrics, TenantPoolManager poolManager) {
        this.metrics = metrics;
        metrics.gauge(AGENCY_POOLS, "Open agency connection pools", poolManager, TenantPoolManager::agencyPoolCount);
        poolManager.addListener(this);
    }

    @Override
    public void poolCreated(DatabasePool pool) {
        metrics.counter(POOLS_CREATED, "Connection pools opened", "kind", pool.kind().name()).increment();
        register(pool, CONNECTIONS_ACTIVE, "Connections in use", PoolStatistics::activeConnections);
        register(pool, CONNECTIONS_IDLE, "Idle connections", PoolStatistics::idleConnections);
        register(pool, THREADS_WAITING, "Threads waiting for a connection", PoolStatistics::waitingThreads);
    }

    @Override
    public void poolClosed(DatabasePool pool, CloseReason reason) {
        metrics.counter(
                        POOLS_CLOSED,
                        "Connection pools closed",
                        "kind",
                        pool.kind().name(),
                        "reason",
                        reason.name())
                .increment();
        metrics.removeDatabaseMeters(CONNECTIONS_ACTIVE, pool.databaseName());
        metrics.removeDatabaseMeters(CONNECTIONS_IDLE, pool.databaseName());
        metrics.removeDatabaseMeters(THREADS_WAITING, pool.databaseName());
    }

    private void register(
            DatabasePool pool, String name, String description, ToIntFunction<PoolStatistics> value) {
        metrics.gauge(
                name,
                description,
                pool,
                p -> p.isClosed() ? 0 : value.applyAsInt(p.statistics()),
                MetricFactory.TAG_DATABASE,
                pool.databaseName());
    }
}

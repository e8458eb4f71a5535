package com.buildflow.database.pool;

import com.buildflow.database.config.DatabaseProperties;
import com.buildflow.database.url.DatabaseUrl;
import com.buildflow.database.url.DatabaseUrlParser;
import com.buildflow.observability.SensitiveDataRedactor;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one connection pool per physical database: the main database plus one per agency.
 *
 * <p>Guarantees:
 *
 * <ul>
 *   <li>At most one live pool per database name. Creation goes through {@link
 *       ConcurrentHashMap#computeIfAbsent}, so concurrent first requests for an unseen agency
 *       create exactly one pool and all receive the same instance.
 *   <li>At most {@code maxAgencyPools} agency pools; going over closes the least recently used.
 *       Pools handed out within the last connection plus statement timeout are never closed for
 *       capacity, so the limit can be exceeded briefly while every pool is busy.
 *   <li>Agency pools idle for longer than {@code poolIdleEviction} are closed by {@link
 *       #evictIdlePools()}, which the application schedules.
 *   <li>A pool is never handed out once eviction has retired it; the caller gets a fresh one.
 *   <li>Creating a pool never opens a connection; an unreachable database fails per statement.
 * </ul>
 *
 * <p>This is a POJO so tests can drive it with a fake {@link PoolFactory} and a fixed {@link
 * Clock}. The Spring wiring lives in {@code TenantDatabaseConfiguration}.
 */
public class TenantPoolManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TenantPoolManager.class);

    static final String MAIN_POOL_NAME = "buildflow-main";
    static final String DEFAULT_MAIN_DATABASE = "postgres";

    private final DatabaseProperties properties;
    private final PoolFactory poolFactory;
    private final Clock clock;
    private final DatabaseUrl serverUrl;
    private final String mainDatabaseName;

    private final Map<String, DatabasePool> agencyPools = new ConcurrentHashMap<>();
    private final Object mainPoolLock = new Object();
    private final Object evictionLock = new Object();
    private final List<PoolEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile DatabasePool mainPool;

    public TenantPoolManager(DatabaseProperties properties, PoolFactory poolFactory, Clock clock) {
        this.properties = properties;
        this.poolFactory = poolFactory;
        this.clock = clock;
        this.serverUrl =
                DatabaseUrlParser.parse(properties.url())
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "buildflow.database.url is not a valid connection"
                                                        + " string: "
                                                        + SensitiveDataRedactor
                                                                .maskConnectionString(
                                                                        properties.url())));
        this.mainDatabaseName =
                serverUrl.database() != null ? serverUrl.database() : DEFAULT_MAIN_DATABASE;
        log.info(
                "Pool manager configured for {}:{} (main database {}, max {} agency pools of {}"
                        + " connections)",
                serverUrl.host(),
                serverUrl.port(),
                mainDatabaseName,
                properties.maxAgencyPools(),
                properties.agencyMaxConnections());
    }

    public void addListener(PoolEventListener listener) {
        listeners.add(listener);
    }

    /** Returns the main database pool, creating it on first use. */
    public DatabasePool getMainPool() {
        ensureOpen();
        DatabasePool pool = mainPool;
        if (pool == null) {
            synchronized (mainPoolLock) {
                ensureOpen();
                pool = mainPool;
                if (pool == null) {
                    pool =
                            createPool(
                                    MAIN_POOL_NAME,
                                    mainDatabaseName,
                                    PoolKind.MAIN,
                                    properties.mainMaxConnections());
                    mainPool = pool;
                }
            }
        }
        pool.touch(clock.instant());
        return pool;
    }

    /**
     * Returns the pool for {@code databaseName}, creating it on first use.
     *
     * @throws IllegalArgumentException if the name is not a valid database name
     * @throws IllegalStateException if the manager has been closed
     */
    public DatabasePool getAgencyPool(String databaseName) {
        String name = DatabaseNameValidator.validate(databaseName);
        ensureOpen();
        DatabasePool pool = agencyPools.computeIfAbsent(name, this::createAgencyPool);
        while (!pool.touch(clock.instant())) {
            // retired between lookup and touch
            agencyPools.remove(name, pool);
            ensureOpen();
            pool = agencyPools.computeIfAbsent(name, this::createAgencyPool);
        }
        if (closed.get()) {
            // closeAll ran after ensureOpen; its snapshot may have missed this pool
            agencyPools.remove(name, pool);
            closePool(pool, PoolEventListener.CloseReason.SHUTDOWN);
            throw new IllegalStateException("Pool manager has been closed");
        }
        if (agencyPools.size() > properties.maxAgencyPools()) {
            evictLeastRecentlyUsed(name);
        }
        return pool;
    }

    /** Whether an agency pool for {@code databaseName} is currently open. */
    public boolean hasAgencyPool(String databaseName) {
        return databaseName != null && agencyPools.containsKey(databaseName.trim());
    }

    public int agencyPoolCount() {
        return agencyPools.size();
    }

    public String mainDatabaseName() {
        return mainDatabaseName;
    }

    /** Connection details of the server all pools connect to. */
    public DatabaseUrl serverUrl() {
        return serverUrl;
    }

    /**
     * Closes and forgets the pool for {@code databaseName}, for example after the agency was
     * deactivated.
     *
     * @return true if a pool was open
     */
    public boolean evictAgencyPool(String databaseName) {
        if (databaseName == null) {
            return false;
        }
        String name = databaseName.trim();
        DatabasePool pool = agencyPools.remove(name);
        if (pool == null) {
            return false;
        }
        closePool(pool, PoolEventListener.CloseReason.EXPLICIT);
        log.info("Evicted agency pool {} on request", name);
        return true;
    }

    /**
     * Closes agency pools not handed out within {@code poolIdleEviction}.
     *
     * @return number of pools closed
     */
    public int evictIdlePools() {
        Instant cutoff = clock.instant().minus(properties.poolIdleEviction());
        int evicted = 0;
        for (Map.Entry<String, DatabasePool> entry : agencyPools.entrySet()) {
            DatabasePool pool = entry.getValue();
            if (pool.retireIfIdleSince(cutoff)) {
                agencyPools.remove(entry.getKey(), pool);
                Duration idle = Duration.between(pool.lastAccess(), clock.instant());
                log.info(
                        "Closing idle agency pool {} (idle {} min, {} accesses)",
                        entry.getKey(),
                        idle.toMinutes(),
                        pool.accessCount());
                closePool(pool, PoolEventListener.CloseReason.IDLE);
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info(
                    "Idle sweep closed {} pools, {}/{} agency pools open",
                    evicted,
                    agencyPools.size(),
                    properties.maxAgencyPools());
        }
        return evicted;
    }

    public PoolManagerStatistics statistics() {
        List<PoolStatistics> agencies = new ArrayList<>();
        for (DatabasePool pool : agencyPools.values()) {
            agencies.add(pool.statistics());
        }
        agencies.sort(Comparator.comparing(PoolStatistics::lastAccess).reversed());
        DatabasePool main = mainPool;
        return new PoolManagerStatistics(
                main != null ? main.statistics() : null,
                agencies,
                properties.maxAgencyPools(),
                properties.agencyMaxConnections());
    }

    /**
     * Closes every pool in parallel, waiting at most {@code timeout}. Afterwards the manager
     * refuses to hand out pools.
     *
     * @return true if all pools closed within the timeout
     */
    public boolean closeAll(Duration timeout) {
        if (!closed.compareAndSet(false, true)) {
            return true;
        }
        List<DatabasePool> toClose = new ArrayList<>(agencyPools.values());
        agencyPools.clear();
        synchronized (mainPoolLock) {
            if (mainPool != null) {
                toClose.add(mainPool);
                mainPool = null;
            }
        }
        log.info("Closing {} connection pools", toClose.size());

        CompletableFuture<?>[] futures =
                toClose.stream()
                        .map(
                                pool ->
                                        CompletableFuture.runAsync(
                                                () ->
                                                        closePool(
                                                                pool,
                                                                PoolEventListener.CloseReason
                                                                        .SHUTDOWN)))
                        .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("All connection pools closed");
            return true;
        } catch (TimeoutException e) {
            log.warn("Timed out after {} closing connection pools", timeout);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing connection pools");
            return false;
        } catch (ExecutionException e) {
            log.warn("Error closing connection pools: {}", e.getCause().getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        closeAll(properties.shutdownTimeout());
    }

    public boolean isClosed() {
        return closed.get();
    }

    private DatabasePool createAgencyPool(String name) {
        if (agencyPools.size() >= properties.maxAgencyPools()) {
            log.warn(
                    "Agency pool limit reached ({}), least recently used pool will be closed",
                    properties.maxAgencyPools());
        }
        DatabasePool pool =
                createPool("agency-" + name, name, PoolKind.AGENCY, properties.agencyMaxConnections());
        log.info(
                "Created agency pool for database {} ({}/{} pools)",
                name,
                agencyPools.size() + 1,
                properties.maxAgencyPools());
        return pool;
    }

    private DatabasePool createPool(String poolName, String database, PoolKind kind, int max) {
        PoolSettings settings =
                new PoolSettings(
                        poolName,
                        database,
                        kind,
                        serverUrl.toJdbcUrl(database),
                        serverUrl.user(),
                        serverUrl.password(),
                        max,
                        properties.idleConnectionTimeout(),
                        properties.connectionTimeout());
        DatabasePool pool =
                new DatabasePool(
                        settings,
                        poolFactory.create(settings),
                        properties.statementTimeout(),
                        clock.instant());
        listeners.forEach(listener -> listener.poolCreated(pool));
        return pool;
    }

    private void evictLeastRecentlyUsed(String justUsed) {
        synchronized (evictionLock) {
            Instant cutoff = clock.instant().minus(evictionGrace());
            while (agencyPools.size() > properties.maxAgencyPools()) {
                Map.Entry<String, DatabasePool> oldest =
                        agencyPools.entrySet().stream()
                                .filter(entry -> !entry.getKey().equals(justUsed))
                                .filter(entry -> !entry.getValue().isRetired())
                                .filter(entry -> entry.getValue().lastAccess().isBefore(cutoff))
                                .min(Comparator.comparing(entry -> entry.getValue().lastAccess()))
                                .orElse(null);
                if (oldest == null) {
                    log.debug(
                            "{} agency pools open over a limit of {}, all used within {}",
                            agencyPools.size(),
                            properties.maxAgencyPools(),
                            evictionGrace());
                    return;
                }
                DatabasePool candidate = oldest.getValue();
                if (candidate.retireIfIdleSince(cutoff)) {
                    agencyPools.remove(oldest.getKey(), candidate);
                    log.info("Evicted agency pool {} (capacity reached)", oldest.getKey());
                    closePool(candidate, PoolEventListener.CloseReason.CAPACITY);
                }
            }
        }
    }

    /** A pool handed out more recently than this may still be running its statement. */
    private Duration evictionGrace() {
        return properties.connectionTimeout().plus(properties.statementTimeout());
    }

    private void closePool(DatabasePool pool, PoolEventListener.CloseReason reason) {
        if (pool.closeOnce()) {
            listeners.forEach(listener -> listener.poolClosed(pool, reason));
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Pool manager has been closed");
        }
    }
}

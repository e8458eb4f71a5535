package com.buildflow.database.pool;

import com.buildflow.database.error.DatabaseErrorKind;
import com.buildflow.database.error.TenantDatabaseException;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * One connection pool bound to one physical database.
 *
 * <p>All statements should go through {@link #execute(Function)}, which is where driver failures
 * are classified into {@link TenantDatabaseException}s. The {@link JdbcTemplate} always returns
 * its connection to the pool, so a statement that times out leaks no checkout.
 */
public class DatabasePool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DatabasePool.class);

    private final String databaseName;
    private final PoolKind kind;
    private final int maxConnections;
    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final Instant createdAt;
    // epoch millis of the last hand-out; stored as -(millis + 1) once retired
    private final AtomicLong lastAccessMillis;
    private final AtomicLong accessCount = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();

    public DatabasePool(
            PoolSettings settings, DataSource dataSource, Duration statementTimeout, Instant now) {
        this.databaseName = settings.databaseName();
        this.kind = settings.kind();
        this.maxConnections = settings.maxConnections();
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout((int) Math.max(1, statementTimeout.toSeconds()));
        this.createdAt = now;
        this.lastAccessMillis = new AtomicLong(now.toEpochMilli());
    }

    /**
     * Runs {@code work} against this pool.
     *
     * @throws TenantDatabaseException classified failure, {@code PoolExhaustedException} when no
     *     connection became available in time
     */
    public <T> T execute(Function<JdbcTemplate, T> work) {
        if (closed.get()) {
            throw new TenantDatabaseException(
                    DatabaseErrorKind.TRANSIENT_FAILURE,
                    databaseName,
                    "Pool for database " + databaseName + " has been closed");
        }
        try {
            return work.apply(jdbcTemplate);
        } catch (DataAccessException e) {
            TenantDatabaseException classified = TenantDatabaseException.from(e, databaseName);
            log.debug("Statement on {} failed: {}", databaseName, classified.kind());
            throw classified;
        }
    }

    /**
     * Records a hand-out at {@code now}.
     *
     * @return false if the pool has been retired or closed and must not be handed out
     */
    boolean touch(Instant now) {
        long millis = now.toEpochMilli();
        while (true) {
            long current = lastAccessMillis.get();
            if (current < 0) {
                return false;
            }
            if (lastAccessMillis.compareAndSet(current, Math.max(current, millis))) {
                accessCount.incrementAndGet();
                return true;
            }
        }
    }

    /**
     * Takes the pool out of service if it was last handed out before {@code cutoff}. A pool
     * touched concurrently wins over the retirement.
     *
     * @return true if this call retired the pool
     */
    boolean retireIfIdleSince(Instant cutoff) {
        long cutoffMillis = cutoff.toEpochMilli();
        while (true) {
            long current = lastAccessMillis.get();
            if (current < 0 || current >= cutoffMillis) {
                return false;
            }
            if (lastAccessMillis.compareAndSet(current, -current - 1)) {
                return true;
            }
        }
    }

    boolean isRetired() {
        return lastAccessMillis.get() < 0;
    }

    public String databaseName() {
        return databaseName;
    }

    public PoolKind kind() {
        return kind;
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public Instant lastAccess() {
        long value = lastAccessMillis.get();
        return Instant.ofEpochMilli(value < 0 ? -value - 1 : value);
    }

    public long accessCount() {
        return accessCount.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public PoolStatistics statistics() {
        int active = 0;
        int idle = 0;
        int total = 0;
        int waiting = 0;
        HikariPoolMXBean mxBean = hikariMxBean();
        if (mxBean != null && !closed.get()) {
            active = mxBean.getActiveConnections();
            idle = mxBean.getIdleConnections();
            total = mxBean.getTotalConnections();
            waiting = mxBean.getThreadsAwaitingConnection();
        }
        return new PoolStatistics(
                databaseName,
                kind,
                active,
                idle,
                total,
                waiting,
                maxConnections,
                accessCount.get(),
                createdAt,
                lastAccess());
    }

    /** Closes the underlying pool. Idempotent. */
    @Override
    public void close() {
        closeOnce();
    }

    /** Closes the underlying pool; returns false if it was already closed. */
    boolean closeOnce() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        retire();
        try {
            if (dataSource instanceof Closeable closeable) {
                closeable.close();
            }
            log.info("Closed pool for database {}", databaseName);
        } catch (IOException | RuntimeException e) {
            log.warn("Error closing pool for database {}: {}", databaseName, e.getMessage());
        }
        return true;
    }

    private void retire() {
        while (true) {
            long current = lastAccessMillis.get();
            if (current < 0 || lastAccessMillis.compareAndSet(current, -current - 1)) {
                return;
            }
        }
    }

    private HikariPoolMXBean hikariMxBean() {
        if (dataSource instanceof HikariDataSource hikari) {
            return hikari.getHikariPoolMXBean();
        }
        return null;
    }

    @Override
    public String toString() {
        return "DatabasePool[" + kind + ":" + databaseName + "]";
    }
}

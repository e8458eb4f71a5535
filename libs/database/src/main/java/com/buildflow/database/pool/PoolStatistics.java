package com.buildflow.database.pool;

import java.time.Instant;

/**
 * Point-in-time view of one pool.
 *
 * @param database physical database name
 * @param kind main or agency
 * @param activeConnections connections currently checked out
 * @param idleConnections open connections waiting in the pool
 * @param totalConnections open connections
 * @param waitingThreads callers blocked waiting for a connection
 * @param maxConnections configured upper bound
 * @param accessCount times the pool was handed out by the manager
 * @param createdAt creation time
 * @param lastAccess last time the pool was handed out
 */
public record PoolStatistics(
        String database,
        PoolKind kind,
        int activeConnections,
        int idleConnections,
        int totalConnections,
        int waitingThreads,
        int maxConnections,
        long accessCount,
        Instant createdAt,
        Instant lastAccess) {}

package com.buildflow.database.pool;

/**
 * Callbacks fired by {@link TenantPoolManager} when pools open and close. Used for metrics.
 */
public interface PoolEventListener {

    /** Why a pool was closed. */
    enum CloseReason {
        CAPACITY,
        IDLE,
        EXPLICIT,
        SHUTDOWN
    }

    default void poolCreated(DatabasePool pool) {}

    default void poolClosed(DatabasePool pool, CloseReason reason) {}
}

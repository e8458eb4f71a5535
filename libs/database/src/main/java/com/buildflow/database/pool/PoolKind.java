package com.buildflow.database.pool;

/** Which database a pool is bound to. */
public enum PoolKind {
    MAIN,
    AGENCY
}

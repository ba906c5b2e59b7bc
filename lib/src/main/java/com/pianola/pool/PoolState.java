package com.pianola.pool;

/**
 * Lifecycle of an {@link ActorPoolManager}. There is no way back to
 * {@code UNINITIALIZED}.
 */
public enum PoolState {
    UNINITIALIZED,
    READY
}

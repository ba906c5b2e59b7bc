package com.pianola.pool;

/**
 * Configuration-level view of the pool. Does not contact any actor.
 *
 * @param status       {@code healthy} once the pool is ready, {@code uninitialized} before
 * @param workerCount  number of workers
 * @param storeActorId id of the store actor, null before initialization
 */
public record PoolHealth(String status, int workerCount, String storeActorId) {

    public static final String HEALTHY = "healthy";
    public static final String UNINITIALIZED = "uninitialized";

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}

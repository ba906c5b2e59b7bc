package com.pianola.pool;

/**
 * Thrown when a pool is initialized with fewer than one worker.
 */
public class InvalidPoolSizeException extends IllegalArgumentException {

    private final int poolSize;

    public InvalidPoolSizeException(int poolSize) {
        super("Pool size must be at least 1: " + poolSize);
        this.poolSize = poolSize;
    }

    public int getPoolSize() {
        return poolSize;
    }
}

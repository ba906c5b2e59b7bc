package com.pianola.config;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory for the threads used in the actor system.
 * Every actor runs its mailbox loop on one dedicated platform thread; the system
 * additionally owns a small scheduler for ask timeouts. This class centralizes how
 * both are created so they can be tuned in one place.
 */
public class ThreadPoolFactory {

    // Default values
    private static final int DEFAULT_SCHEDULER_THREADS = 1;
    private static final int DEFAULT_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS = 5;
    private static final int DEFAULT_ACTOR_SHUTDOWN_TIMEOUT_SECONDS = 5;
    private static final int DEFAULT_ACTOR_BATCH_SIZE = 10;
    private static final int DEFAULT_ACTOR_START_TIMEOUT_SECONDS = 5;

    // Scheduler configuration
    private int schedulerThreads = DEFAULT_SCHEDULER_THREADS;
    private int schedulerShutdownTimeoutSeconds = DEFAULT_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS;

    // Actor execution configuration
    private int actorShutdownTimeoutSeconds = DEFAULT_ACTOR_SHUTDOWN_TIMEOUT_SECONDS;
    private int actorStartTimeoutSeconds = DEFAULT_ACTOR_START_TIMEOUT_SECONDS;
    private int actorBatchSize = DEFAULT_ACTOR_BATCH_SIZE;
    private boolean daemonThreads = true;

    /**
     * Creates a new ThreadPoolFactory with default settings.
     */
    public ThreadPoolFactory() {
        // Use defaults
    }

    /**
     * Creates the dedicated, unstarted thread that runs an actor's mailbox loop.
     *
     * @param actorId the actor the thread belongs to
     * @param loop the mailbox loop
     * @return a platform thread named {@code actor-<actorId>}
     */
    public Thread createActorThread(String actorId, Runnable loop) {
        Thread thread = new Thread(loop, "actor-" + actorId);
        thread.setDaemon(daemonThreads);
        return thread;
    }

    /**
     * Creates a scheduled executor service based on the current configuration.
     * Cancelled tasks are removed from the work queue immediately, so ask timeouts
     * that never fire do not accumulate.
     *
     * @param poolName Name prefix for the threads in this pool
     * @return A new scheduled executor service
     */
    public ScheduledExecutorService createScheduledExecutorService(String poolName) {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                schedulerThreads, createNamedThreadFactory(poolName + "-scheduler"));
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * Creates a named thread factory for better thread identification in logs and profilers.
     *
     * @param prefix The prefix for thread names
     * @return A thread factory that creates named threads
     */
    private ThreadFactory createNamedThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, prefix + "-" + threadNumber.getAndIncrement());
                thread.setDaemon(true);
                return thread;
            }
        };
    }

    // Getters and setters

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public ThreadPoolFactory setSchedulerThreads(int schedulerThreads) {
        if (schedulerThreads <= 0) {
            throw new IllegalArgumentException("schedulerThreads must be positive: " + schedulerThreads);
        }
        this.schedulerThreads = schedulerThreads;
        return this;
    }

    public int getSchedulerShutdownTimeoutSeconds() {
        return schedulerShutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setSchedulerShutdownTimeoutSeconds(int schedulerShutdownTimeoutSeconds) {
        this.schedulerShutdownTimeoutSeconds = schedulerShutdownTimeoutSeconds;
        return this;
    }

    public int getActorShutdownTimeoutSeconds() {
        return actorShutdownTimeoutSeconds;
    }

    public ThreadPoolFactory setActorShutdownTimeoutSeconds(int actorShutdownTimeoutSeconds) {
        this.actorShutdownTimeoutSeconds = actorShutdownTimeoutSeconds;
        return this;
    }

    public int getActorStartTimeoutSeconds() {
        return actorStartTimeoutSeconds;
    }

    public ThreadPoolFactory setActorStartTimeoutSeconds(int actorStartTimeoutSeconds) {
        this.actorStartTimeoutSeconds = actorStartTimeoutSeconds;
        return this;
    }

    public int getActorBatchSize() {
        return actorBatchSize;
    }

    public ThreadPoolFactory setActorBatchSize(int actorBatchSize) {
        if (actorBatchSize <= 0) {
            throw new IllegalArgumentException("actorBatchSize must be positive: " + actorBatchSize);
        }
        this.actorBatchSize = actorBatchSize;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }
}

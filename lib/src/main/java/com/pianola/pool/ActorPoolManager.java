package com.pianola.pool;

import com.pianola.ActorSystem;
import com.pianola.Pid;
import com.pianola.note.NoteProcessorHandler;
import com.pianola.note.NoteProcessorMessage;
import com.pianola.store.NoteStoreConnector;
import com.pianola.store.StoreHandler;
import com.pianola.store.StoreMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the note processing workers and the store actor, and hands out workers in
 * round-robin order.
 * <p>
 * {@link #nextWorker()} is safe to call from any number of threads: the cursor read
 * and advance are one atomic step, so for {@code K} concurrent callers the pool
 * hands out exactly {@code K} consecutive positions modulo the pool size.
 */
public class ActorPoolManager {

    private static final Logger logger = LoggerFactory.getLogger(ActorPoolManager.class);

    static final String WORKER_ID_PREFIX = "note-processor-";
    static final String STORE_ACTOR_ID = "note-store";

    private final ActorSystem system;
    private final PoolConfig config;
    private final NoteStoreConnector storeConnector;
    private final AtomicInteger cursor = new AtomicInteger();

    private volatile PoolState state = PoolState.UNINITIALIZED;
    private volatile List<Pid> workers = List.of();
    private volatile Pid storeActor;

    public ActorPoolManager(ActorSystem system, PoolConfig config, NoteStoreConnector storeConnector) {
        this.system = system;
        this.config = config;
        this.storeConnector = storeConnector;
    }

    /**
     * Initializes the pool with the configured size.
     *
     * @see #initialize(int)
     */
    public void initialize() {
        initialize(config.getPoolSize());
    }

    /**
     * Creates {@code poolSize} workers with ids {@code 0..poolSize-1} and the store
     * actor, and moves the pool to {@link PoolState#READY}. The store connection is
     * attempted before this method returns.
     *
     * @param poolSize number of workers
     * @throws InvalidPoolSizeException if {@code poolSize <= 0}
     * @throws IllegalStateException if the pool was already initialized
     */
    public synchronized void initialize(int poolSize) {
        if (poolSize <= 0) {
            throw new InvalidPoolSizeException(poolSize);
        }
        if (state != PoolState.UNINITIALIZED) {
            throw new IllegalStateException("Pool already initialized with " + workers.size() + " workers");
        }

        List<Pid> created = new ArrayList<>(poolSize);
        for (int workerId = 0; workerId < poolSize; workerId++) {
            Pid worker = system.<NoteProcessorMessage>actorOf(new NoteProcessorHandler(workerId, config.getSimulatedWork()))
                    .withId(WORKER_ID_PREFIX + workerId)
                    .withMailboxConfig(config.getMailboxConfig())
                    .spawn();
            created.add(worker);
        }
        storeActor = system.<StoreMessage>actorOf(new StoreHandler(storeConnector))
                .withId(STORE_ACTOR_ID)
                .withMailboxConfig(config.getMailboxConfig())
                .spawn();

        workers = List.copyOf(created);
        cursor.set(0);
        state = PoolState.READY;
        logger.info("Actor pool ready with {} workers and store actor {}", poolSize, storeActor.actorId());
    }

    /**
     * Returns the worker at the cursor and advances the cursor.
     *
     * @throws IllegalStateException if the pool is not initialized
     */
    public Pid nextWorker() {
        List<Pid> current = requireReady();
        int index = cursor.getAndUpdate(i -> (i + 1) % current.size());
        return current.get(index);
    }

    /**
     * Returns the store actor.
     *
     * @throws IllegalStateException if the pool is not initialized
     */
    public Pid storeActor() {
        requireReady();
        return storeActor;
    }

    /**
     * Workers ordered by worker id; empty before initialization.
     */
    public List<Pid> workers() {
        return workers;
    }

    public int poolSize() {
        return workers.size();
    }

    public PoolState state() {
        return state;
    }

    public PoolConfig config() {
        return config;
    }

    public PoolHealth health() {
        if (state != PoolState.READY) {
            return new PoolHealth(PoolHealth.UNINITIALIZED, 0, null);
        }
        return new PoolHealth(PoolHealth.HEALTHY, workers.size(), storeActor.actorId());
    }

    /**
     * Stops every worker and the store actor. The pool keeps its state; requests to
     * its actors fail afterwards.
     */
    public synchronized void shutdown() {
        if (state != PoolState.READY) {
            return;
        }
        logger.info("Stopping actor pool");
        for (Pid worker : workers) {
            system.stopActor(worker);
        }
        system.stopActor(storeActor);
    }

    private List<Pid> requireReady() {
        if (state != PoolState.READY) {
            throw new IllegalStateException("Pool is not initialized");
        }
        return workers;
    }
}

package com.pianola.service;

import com.pianola.ActorSystem;
import com.pianola.config.ThreadPoolFactory;
import com.pianola.pool.ActorPoolManager;
import com.pianola.pool.PoolConfig;
import com.pianola.store.InMemoryNoteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Boots the actor system and the pool, then waits until the JVM shuts down.
 */
public final class PianolaApplication {

    private static final Logger logger = LoggerFactory.getLogger(PianolaApplication.class);

    private PianolaApplication() {
    }

    public static void main(String[] args) throws InterruptedException {
        PoolConfig config = PoolConfig.fromSystemProperties();
        ActorSystem system = new ActorSystem(new ThreadPoolFactory(), config.getMailboxConfig());
        ActorPoolManager pool = new ActorPoolManager(system, config, new InMemoryNoteStore());
        pool.initialize();

        PianoService service = new PianoService(pool);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down");
            pool.shutdown();
            system.shutdown();
            stopped.countDown();
        }, "pianola-shutdown"));

        logger.info("Pianola ready: {}", service.health());
        logger.info("Configuration: {}", config);
        stopped.await();
    }
}

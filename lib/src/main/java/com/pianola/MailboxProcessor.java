package com.pianola;

import com.pianola.config.ThreadPoolFactory;
import com.pianola.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Encapsulates mailbox polling and message dispatch for an actor.
 * Runs the loop on the actor's dedicated thread and handles batching, interruption,
 * exception routing, and hand-off of messages that will never be processed.
 *
 * @param <T> The type of messages in the mailbox
 */
public class MailboxProcessor<T> {
    private static final Logger logger = LoggerFactory.getLogger(MailboxProcessor.class);

    // poll() returns as soon as a message arrives; the bound only paces the running check
    private static final long POLL_TIMEOUT_MS = 50;

    private final String actorId;
    private final Mailbox<T> mailbox;
    private final int batchSize;
    private final List<T> batchBuffer;
    private final BiConsumer<T, RuntimeException> exceptionHandler;
    private final ActorLifecycle<T> lifecycle;
    private final ThreadPoolFactory threadPoolFactory;

    private volatile boolean running = false;
    private volatile Thread thread;
    private volatile RuntimeException startFailure;
    private CountDownLatch readyLatch;

    /**
     * Creates a new mailbox processor.
     *
     * @param actorId           The ID of the actor for logging
     * @param mailbox           The mailbox to poll messages from
     * @param exceptionHandler  Handler to route message processing errors
     * @param lifecycle         Lifecycle hooks
     * @param threadPoolFactory Creates the actor thread and supplies batch size and timeouts
     */
    public MailboxProcessor(
            String actorId,
            Mailbox<T> mailbox,
            BiConsumer<T, RuntimeException> exceptionHandler,
            ActorLifecycle<T> lifecycle,
            ThreadPoolFactory threadPoolFactory) {
        this.actorId = actorId;
        this.mailbox = mailbox;
        this.batchSize = threadPoolFactory.getActorBatchSize();
        this.batchBuffer = new ArrayList<>(batchSize);
        this.exceptionHandler = exceptionHandler;
        this.lifecycle = lifecycle;
        this.threadPoolFactory = threadPoolFactory;
    }

    /**
     * Starts the actor thread and blocks until {@code preStart} has run on it, so the
     * actor is fully initialized when this method returns.
     *
     * @throws ActorException if preStart fails or the thread does not come up in time
     */
    public void start() {
        if (running) {
            logger.debug("Actor {} mailbox already running", actorId);
            return;
        }
        running = true;
        logger.debug("Starting actor {} mailbox", actorId);

        readyLatch = new CountDownLatch(1);
        thread = threadPoolFactory.createActorThread(actorId, this::processMailboxLoop);
        thread.start();

        try {
            if (!readyLatch.await(threadPoolFactory.getActorStartTimeoutSeconds(), TimeUnit.SECONDS)) {
                logger.warn("Actor {} did not start within timeout", actorId);
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for actor {} to start", actorId);
            Thread.currentThread().interrupt();
        }
        if (startFailure != null) {
            throw new ActorException("Actor failed to start", startFailure, actorId);
        }
    }

    /**
     * Stops mailbox polling. When called from another thread, interrupts the actor thread
     * and waits for it to finish the message in progress. When called from the actor
     * thread itself, the loop ends after the current message.
     * Messages that will not be processed are handed to {@link ActorLifecycle#undelivered},
     * then {@link ActorLifecycle#postStop} runs, both on the actor thread. If the handler
     * outlives the shutdown timeout this method returns first and the actor thread
     * runs them once the handler returns.
     */
    public void stop() {
        running = false;
        Thread current = thread;
        if (current == null) {
            // never started: no actor thread exists to run the hooks on
            drainUndelivered(List.of());
            runPostStop();
            return;
        }
        if (Thread.currentThread() != current) {
            current.interrupt();
            try {
                current.join(TimeUnit.SECONDS.toMillis(threadPoolFactory.getActorShutdownTimeoutSeconds()));
                if (current.isAlive()) {
                    logger.warn("Actor {} did not stop within {} seconds",
                            actorId, threadPoolFactory.getActorShutdownTimeoutSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Returns true if the mailbox processor is running.
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * Gets the current number of messages in the mailbox.
     */
    public int getCurrentSize() {
        return mailbox.size();
    }

    private void processMailboxLoop() {
        boolean started = false;
        try {
            lifecycle.preStart();
            started = true;
        } catch (RuntimeException e) {
            logger.error("Actor {} failed in preStart", actorId, e);
            startFailure = e;
            running = false;
        } finally {
            readyLatch.countDown();
        }

        int next = 0;
        try {
            while (running) {
                batchBuffer.clear();
                next = 0;
                T first;
                try {
                    first = mailbox.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    if (!running) {
                        logger.debug("Actor {} mailbox interrupted", actorId);
                        break;
                    }
                    logger.debug("Actor {} ignoring interrupt while running", actorId);
                    continue;
                }
                if (first == null) {
                    continue;
                }
                batchBuffer.add(first);
                if (batchSize > 1) {
                    mailbox.drainTo(batchBuffer, batchSize - 1);
                }
                while (running && next < batchBuffer.size()) {
                    T msg = batchBuffer.get(next++);
                    try {
                        lifecycle.receive(msg);
                    } catch (RuntimeException e) {
                        exceptionHandler.accept(msg, e);
                    }
                }
            }
        } finally {
            List<T> leftover = next < batchBuffer.size()
                    ? new ArrayList<>(batchBuffer.subList(next, batchBuffer.size()))
                    : List.of();
            batchBuffer.clear();
            drainUndelivered(leftover);
            if (started) {
                // the interrupt that ended the loop must not leak into cleanup
                Thread.interrupted();
                runPostStop();
            }
        }
    }

    private void runPostStop() {
        try {
            lifecycle.postStop();
        } catch (RuntimeException e) {
            logger.error("Actor {} failed in postStop", actorId, e);
        }
    }

    private void drainUndelivered(List<T> leftover) {
        List<T> remaining = new ArrayList<>(leftover);
        mailbox.drainTo(remaining, Integer.MAX_VALUE);
        if (!remaining.isEmpty()) {
            logger.debug("Actor {} leaving {} messages undelivered", actorId, remaining.size());
        }
        for (T message : remaining) {
            lifecycle.undelivered(message);
        }
    }
}

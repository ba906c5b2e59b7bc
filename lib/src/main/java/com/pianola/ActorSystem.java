package com.pianola;

import com.pianola.builder.ActorBuilder;
import com.pianola.config.ThreadPoolFactory;
import com.pianola.handler.Handler;
import com.pianola.mailbox.config.DefaultMailboxProvider;
import com.pianola.mailbox.config.MailboxConfig;
import com.pianola.mailbox.config.MailboxProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry and entry point of the actor runtime: creates actors, routes messages to
 * them, runs the ask protocol, and shuts everything down.
 */
public class ActorSystem {

    private static final Logger logger = LoggerFactory.getLogger(ActorSystem.class);

    private final ConcurrentHashMap<String, Actor<?>> actors = new ConcurrentHashMap<>();
    private final ThreadPoolFactory threadPoolFactory;
    private final MailboxConfig mailboxConfig;
    private final MailboxProvider<Object> mailboxProvider;
    private final ScheduledExecutorService delayScheduler;

    // Asks whose slot has not been completed yet, by ask id
    private final ConcurrentHashMap<String, AskEnvelope<?>> pendingAsks = new ConcurrentHashMap<>();
    private final AtomicLong askSequence = new AtomicLong();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    /**
     * Creates a new ActorSystem with the default configuration.
     */
    public ActorSystem() {
        this(new ThreadPoolFactory(), new MailboxConfig(), new DefaultMailboxProvider<>());
    }

    /**
     * Creates a new ActorSystem with the specified thread pool configuration.
     *
     * @param threadPoolFactory The thread pool configuration
     */
    public ActorSystem(ThreadPoolFactory threadPoolFactory) {
        this(threadPoolFactory, new MailboxConfig(), new DefaultMailboxProvider<>());
    }

    /**
     * Creates a new ActorSystem with the specified thread pool and default mailbox configuration.
     *
     * @param threadPoolFactory The thread pool configuration
     * @param mailboxConfig     The mailbox configuration used when an actor does not specify one
     */
    public ActorSystem(ThreadPoolFactory threadPoolFactory, MailboxConfig mailboxConfig) {
        this(threadPoolFactory, mailboxConfig, new DefaultMailboxProvider<>());
    }

    /**
     * Creates a new ActorSystem.
     *
     * @param threadPoolFactory The thread pool configuration
     * @param mailboxConfig     The mailbox configuration used when an actor does not specify one
     * @param mailboxProvider   Creates actor mailboxes
     */
    public ActorSystem(ThreadPoolFactory threadPoolFactory,
                       MailboxConfig mailboxConfig,
                       MailboxProvider<Object> mailboxProvider) {
        this.threadPoolFactory = Objects.requireNonNull(threadPoolFactory, "threadPoolFactory");
        this.mailboxConfig = Objects.requireNonNull(mailboxConfig, "mailboxConfig");
        this.mailboxProvider = Objects.requireNonNull(mailboxProvider, "mailboxProvider");
        this.delayScheduler = threadPoolFactory.createScheduledExecutorService("actor-system");
    }

    /**
     * Creates an actor builder for the specified handler instance.
     *
     * @param handler   The handler instance
     * @param <Message> The type of messages the handler processes
     * @return A builder for configuring and creating the actor
     */
    public <Message> ActorBuilder<Message> actorOf(Handler<Message> handler) {
        return new ActorBuilder<>(this, handler);
    }

    /**
     * Registers an actor with this system.
     * This method is used by the builder classes.
     *
     * @param actor The actor to register
     * @throws ActorException if the id is already taken or the system is shut down
     */
    public void registerActor(Actor<?> actor) {
        if (shutdown.get()) {
            throw new ActorException("Actor system is shut down", actor.getActorId());
        }
        Actor<?> existing = actors.putIfAbsent(actor.getActorId(), actor);
        if (existing != null) {
            throw new ActorException("Actor id already in use", actor.getActorId());
        }
    }

    /**
     * Stops and removes the actor with the specified ID.
     *
     * @param actorId The ID of the actor to shut down
     */
    public void shutdown(String actorId) {
        Actor<?> actor = actors.remove(actorId);
        if (actor != null) {
            actor.stop();
        }
    }

    /**
     * Stops an actor identified by its Pid. The actor stays registered, so later
     * requests to it fail with {@code MAILBOX_CLOSED} rather than {@code ACTOR_NOT_FOUND}.
     *
     * @param pid The Pid of the actor to stop
     */
    public void stopActor(Pid pid) {
        Actor<?> actor = actors.get(pid.actorId());
        if (actor != null) {
            actor.stop();
        }
    }

    public Actor<?> getActor(Pid pid) {
        return actors.get(pid.actorId());
    }

    public Optional<Actor<?>> getActorOptional(Pid pid) {
        return Optional.ofNullable(getActor(pid));
    }

    /**
     * Sends a message to an actor without waiting for a reply.
     *
     * @param pid     The PID of the actor to send the message to
     * @param message The message to send
     * @return true if the message was enqueued
     */
    @SuppressWarnings("unchecked")
    public boolean tell(Pid pid, Object message) {
        Objects.requireNonNull(message, "message");
        Actor<Object> actor = (Actor<Object>) actors.get(pid.actorId());
        if (actor == null) {
            logger.warn("Failed to route message to actor {}: Actor not found", pid.actorId());
            return false;
        }
        return actor.tell(message);
    }

    /**
     * Sends a request to an actor and returns its pending reply.
     * <p>
     * The returned reply always ends with exactly one {@link Outcome}: the handler's
     * value, the handler's failure, or a transport failure when the request could not
     * be enqueued, the actor stopped first, the timeout expired, or the system shut down.
     * A request that timed out may still be processed by the actor later; its reply is
     * then discarded.
     *
     * @param target  The Pid of the target actor
     * @param request The request to send
     * @param timeout How long to wait for the reply
     * @param <R>     The reply type
     * @return The pending reply
     */
    public <R> Reply<R> ask(Pid target, Request<R> request, Duration timeout) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(timeout, "timeout");
        String actorId = target.actorId();
        if (shutdown.get()) {
            return Reply.completed(actorId, Outcome.transportFailure(TransportException.Kind.SYSTEM_SHUTDOWN,
                    actorId, "Actor system is shut down"));
        }
        Actor<?> actor = actors.get(actorId);
        if (actor == null) {
            return Reply.completed(actorId, Outcome.transportFailure(TransportException.Kind.ACTOR_NOT_FOUND,
                    actorId, "Target actor not found: " + actorId));
        }

        String askId = "ask-" + askSequence.incrementAndGet();
        CompletableFuture<Outcome<R>> slot = new CompletableFuture<>();
        AskEnvelope<R> envelope = new AskEnvelope<>(askId, request, slot);
        pendingAsks.put(askId, envelope);

        ScheduledFuture<?> timeoutFuture;
        try {
            timeoutFuture = delayScheduler.schedule(() -> {
                if (envelope.complete(Outcome.transportFailure(TransportException.Kind.TIMEOUT, actorId,
                        "Timeout waiting for response from " + actorId + " after " + timeout))) {
                    logger.debug("Ask {} to actor {} timed out", askId, actorId);
                }
            }, timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            pendingAsks.remove(askId);
            return Reply.completed(actorId, Outcome.transportFailure(new TransportException(
                    TransportException.Kind.SYSTEM_SHUTDOWN, actorId, "Actor system is shutting down", e)));
        }
        slot.whenComplete((outcome, error) -> {
            timeoutFuture.cancel(false);
            pendingAsks.remove(askId);
        });

        actor.deliver(envelope);
        return Reply.from(actorId, slot);
    }

    /**
     * Number of asks still waiting for an outcome.
     */
    public int getPendingAskCount() {
        return pendingAsks.size();
    }

    /**
     * Shuts the system down: completes every pending ask with
     * {@code TransportFailure(SYSTEM_SHUTDOWN)}, stops every actor, and stops the
     * timeout scheduler. Calling it again has no effect.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down all actors in the system");

        for (AskEnvelope<?> pending : new ArrayList<>(pendingAsks.values())) {
            pending.complete(Outcome.transportFailure(TransportException.Kind.SYSTEM_SHUTDOWN,
                    null, "Actor system shutting down"));
        }

        List<String> actorIds = new ArrayList<>(actors.keySet());
        for (String actorId : actorIds) {
            Actor<?> actor = actors.remove(actorId);
            if (actor == null) {
                continue;
            }
            try {
                actor.stop();
                logger.debug("Actor {} shut down successfully", actorId);
            } catch (RuntimeException e) {
                logger.warn("Error shutting down actor {}", actorId, e);
            }
        }

        safeShutdownScheduler(delayScheduler);
        logger.info("Actor system shut down successfully");
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    private void safeShutdownScheduler(ScheduledExecutorService scheduler) {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(threadPoolFactory.getSchedulerShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Generates a unique actor ID.
     *
     * @param prefix Prefix for the generated id
     * @return A new actor id
     */
    public String generateActorId(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threadPoolFactory;
    }

    public MailboxConfig getMailboxConfig() {
        return mailboxConfig;
    }

    public MailboxProvider<Object> getMailboxProvider() {
        return mailboxProvider;
    }
}

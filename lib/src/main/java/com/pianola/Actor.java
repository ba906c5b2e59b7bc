package com.pianola;

import com.pianola.config.ThreadPoolFactory;
import com.pianola.mailbox.Mailbox;
import com.pianola.mailbox.MailboxClosedException;
import com.pianola.mailbox.config.MailboxConfig;
import com.pianola.mailbox.config.MailboxProvider;
import com.pianola.mailbox.config.OverflowStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An actor: private state, a mailbox, and one thread that processes the mailbox
 * strictly one message at a time, in arrival order. Subclasses implement
 * {@link #receive(Object)} and never need locks for their own state.
 * <p>
 * Requests sent with {@link ActorSystem#ask} travel through the same mailbox wrapped
 * in an {@link AskEnvelope}; every one of them ends with exactly one {@link Outcome}.
 *
 * @param <Message> The type of messages this actor processes
 */
public abstract class Actor<Message> {

    private static final Logger logger = LoggerFactory.getLogger(Actor.class);

    private final ActorSystem system;
    private final String actorId;
    private final Pid pid;
    private final Mailbox<Object> mailbox;
    private final MailboxConfig mailboxConfig;
    private final MailboxProcessor<Object> mailboxProcessor;
    private final Logger actorLogger;
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile SupervisionStrategy supervisionStrategy = SupervisionStrategy.RESUME;

    // Only read and written on the actor thread.
    private AskEnvelope<?> currentAsk;

    /**
     * Creates a new actor with the system's mailbox configuration and thread pool factory.
     *
     * @param system  The actor system
     * @param actorId The actor ID
     */
    public Actor(ActorSystem system, String actorId) {
        this(system, actorId, system.getMailboxConfig(), system.getThreadPoolFactory(), system.getMailboxProvider());
    }

    /**
     * Creates a new actor.
     *
     * @param system            The actor system
     * @param actorId           The actor ID
     * @param mailboxConfig     The mailbox configuration
     * @param threadPoolFactory Creates the actor thread
     * @param mailboxProvider   Creates the mailbox from the configuration
     */
    protected Actor(ActorSystem system,
                    String actorId,
                    MailboxConfig mailboxConfig,
                    ThreadPoolFactory threadPoolFactory,
                    MailboxProvider<Object> mailboxProvider) {
        this.system = system;
        this.actorId = actorId;
        this.pid = new Pid(actorId, system);
        this.mailboxConfig = mailboxConfig;
        this.mailbox = mailboxProvider.createMailbox(mailboxConfig);
        this.actorLogger = LoggerFactory.getLogger(getClass().getName() + "." + actorId);
        this.mailboxProcessor = new MailboxProcessor<>(
                actorId,
                mailbox,
                this::handleException,
                new ActorLifecycle<>() {
                    @Override
                    public void preStart() {
                        Actor.this.preStart();
                    }

                    @Override
                    public void receive(Object message) {
                        dispatch(message);
                    }

                    @Override
                    public void undelivered(Object message) {
                        Actor.this.undelivered(message);
                    }

                    @Override
                    public void postStop() {
                        Actor.this.postStop();
                    }
                },
                threadPoolFactory);
        logger.debug("Actor {} created with mailbox {}", actorId, mailboxConfig);
    }

    /**
     * Processes a received message.
     * This method must be implemented by concrete actor classes to define message handling behavior.
     * When the message is a request, the implementation answers it with
     * {@link #reply(Request, Object)}.
     *
     * @param message the message to process
     */
    protected abstract void receive(Message message);

    /**
     * Called on the actor thread before the first message is processed.
     * Override to perform initialization logic.
     */
    protected void preStart() {
        // Default implementation does nothing
    }

    /**
     * Called once on the actor thread after the last message has been processed.
     * Override to release resources.
     */
    protected void postStop() {
        // Default implementation does nothing
    }

    /**
     * Called on the actor thread when {@link #receive} throws something other than a
     * {@link HandlerException}, before the supervision strategy is applied.
     *
     * @param message   The message that caused the exception
     * @param exception The exception that was thrown
     */
    protected void onError(Message message, RuntimeException exception) {
        // Default implementation does nothing
    }

    /**
     * Starts the actor thread. Returns once {@link #preStart()} has completed on it.
     */
    public void start() {
        mailboxProcessor.start();
    }

    /**
     * Stops the actor: closes the mailbox so no new message is accepted, lets the
     * message in progress finish, fails every request still queued with
     * {@code TransportFailure(ACTOR_TERMINATED)}, and runs {@link #postStop()} on the
     * actor thread. Waits for that unless called from the actor thread itself, or the
     * current message outlasts the shutdown timeout. Calling it again has no effect.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.debug("Stopping actor {}", actorId);
        mailbox.close();
        mailboxProcessor.stop();
        logger.info("Actor {} stopped after processing {} messages", actorId, processedCount.get());
    }

    /**
     * Sends a message to this actor without waiting for a reply.
     *
     * @param message The message to send
     * @return true if the message was enqueued, false if the mailbox is closed or full
     */
    public boolean tell(Message message) {
        try {
            return enqueue(message);
        } catch (MailboxClosedException e) {
            logger.debug("Actor {} dropped message, mailbox closed: {}", actorId, message);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Enqueues a request; if that fails the request's slot is completed with the
     * matching transport failure instead.
     */
    <R> void deliver(AskEnvelope<R> envelope) {
        try {
            if (!enqueue(envelope)) {
                envelope.complete(Outcome.transportFailure(TransportException.Kind.MAILBOX_FULL, actorId,
                        "Mailbox of actor " + actorId + " is full"));
            }
        } catch (MailboxClosedException e) {
            envelope.complete(Outcome.transportFailure(new TransportException(
                    TransportException.Kind.MAILBOX_CLOSED, actorId, "Mailbox of actor " + actorId + " is closed", e)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            envelope.complete(Outcome.transportFailure(new TransportException(
                    TransportException.Kind.MAILBOX_FULL, actorId,
                    "Interrupted while waiting for room in the mailbox of actor " + actorId, e)));
        }
    }

    private boolean enqueue(Object message) throws InterruptedException {
        if (mailboxConfig.getOverflowStrategy() == OverflowStrategy.REJECT) {
            return mailbox.offer(message);
        }
        return mailbox.offer(message, mailboxConfig.getEnqueueTimeout().toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Answers the request currently being processed.
     *
     * @param request  the request being answered, which must be the current message
     * @param response the reply value
     * @param <R>      the reply type
     * @return true if the reply completed a pending ask
     */
    protected <R> boolean reply(Request<R> request, R response) {
        AskEnvelope<?> ask = currentAsk;
        if (ask == null || ask.message() != request) {
            actorLogger.debug("Ignoring reply to {}: not the request being processed", request);
            return false;
        }
        boolean completed = ask.completeWithReply(response);
        if (!completed) {
            actorLogger.debug("Reply to {} arrived after the ask was already completed", ask.askId());
        }
        return completed;
    }

    /**
     * Returns true while the message being processed is a request that expects a reply.
     */
    protected boolean isAsk() {
        return currentAsk != null;
    }

    @SuppressWarnings("unchecked")
    private void dispatch(Object envelope) {
        AskEnvelope<?> ask = envelope instanceof AskEnvelope<?> askEnvelope ? askEnvelope : null;
        Message message = (Message) (ask != null ? ask.message() : envelope);
        currentAsk = ask;
        boolean completedNormally = false;
        try {
            receive(message);
            completedNormally = true;
        } catch (HandlerException e) {
            actorLogger.debug("Handler reported failure {} for {}", e.getCode(), message);
            failAsk(ask, e);
            completedNormally = true;
        } catch (RuntimeException e) {
            failAsk(ask, HandlerException.unexpected(actorId, e));
            throw e;
        } catch (Error e) {
            logger.error("Actor {} thread failed fatally while processing {}", actorId, message, e);
            if (ask != null) {
                ask.complete(Outcome.transportFailure(TransportException.Kind.ACTOR_TERMINATED, actorId,
                        "Actor " + actorId + " terminated while processing the request"));
            }
            stop();
            throw e;
        } finally {
            currentAsk = null;
            processedCount.incrementAndGet();
            if (completedNormally && ask != null && !ask.isCompleted()) {
                ask.complete(Outcome.handlerFailure(new HandlerException(HandlerException.Code.NO_REPLY,
                        "Actor " + actorId + " did not reply to " + message)));
            }
        }
    }

    private void failAsk(AskEnvelope<?> ask, HandlerException error) {
        if (ask != null) {
            ask.complete(Outcome.handlerFailure(error));
        }
    }

    private void undelivered(Object message) {
        if (message instanceof AskEnvelope<?> ask) {
            ask.complete(Outcome.transportFailure(TransportException.Kind.ACTOR_TERMINATED, actorId,
                    "Actor " + actorId + " stopped before processing the request"));
        } else {
            logger.debug("Actor {} stopped before processing {}", actorId, message);
        }
    }

    @SuppressWarnings("unchecked")
    private void handleException(Object envelope, RuntimeException exception) {
        Object message = envelope instanceof AskEnvelope<?> ask ? ask.message() : envelope;
        actorLogger.error("Error processing message {}", message, exception);
        Supervisor.handleException(this, (Message) message, exception);
    }

    public Pid self() {
        return pid;
    }

    public String getActorId() {
        return actorId;
    }

    /**
     * Gets the actor system this actor belongs to.
     *
     * @return The actor system
     */
    public ActorSystem getSystem() {
        return system;
    }

    /**
     * Gets the logger for this actor, named after the actor class and id.
     *
     * @return A logger instance configured for this actor
     */
    public Logger getLogger() {
        return actorLogger;
    }

    /**
     * Number of messages this actor has finished processing, successfully or not.
     * Only the actor thread increments it.
     */
    public long getProcessedCount() {
        return processedCount.get();
    }

    public boolean isRunning() {
        return mailboxProcessor.isRunning() && !stopped.get();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public int getCurrentSize() {
        return mailboxProcessor.getCurrentSize();
    }

    /**
     * Sets the supervision strategy for this actor.
     *
     * @param strategy The supervision strategy to use
     * @return This actor instance for method chaining
     */
    public Actor<Message> withSupervisionStrategy(SupervisionStrategy strategy) {
        this.supervisionStrategy = strategy;
        return this;
    }

    public SupervisionStrategy getSupervisionStrategy() {
        return supervisionStrategy;
    }
}

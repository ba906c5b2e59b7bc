package com.pianola;

/**
 * Defines lifecycle callbacks for an actor used by MailboxProcessor.
 *
 * @param <T> The type of messages accepted by the actor
 */
public interface ActorLifecycle<T> {
    /** Called on the actor thread before mailbox processing begins. */
    void preStart();

    /**
     * Called on the actor thread to dispatch a received message to the actor.
     *
     * @param message the message to be processed by the actor
     */
    void receive(T message);

    /**
     * Called for every message that was enqueued but will never be processed
     * because the mailbox loop has ended.
     *
     * @param message the message left behind
     */
    void undelivered(T message);

    /**
     * Called once on the actor thread after the last message has been processed and
     * the undelivered messages have been handed off. Not called if preStart failed.
     */
    void postStop();
}

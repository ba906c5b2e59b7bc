package com.pianola.handler;

import com.pianola.ActorContext;

/**
 * Interface for handling the messages of an actor.
 * Keeps the message handling logic, and the state it needs, apart from the actor
 * runtime. A handler instance belongs to exactly one actor and is only ever invoked
 * from that actor's thread.
 *
 * @param <Message> The type of messages this handler processes
 */
public interface Handler<Message> {

    /**
     * Processes a message. Requests are answered with
     * {@link ActorContext#reply(com.pianola.Request, Object)}; business failures are
     * reported by throwing a {@link com.pianola.HandlerException}.
     *
     * @param message The message to process
     * @param context The actor context providing access to actor functionality
     */
    void receive(Message message, ActorContext context);

    /**
     * Called on the actor thread before the first message is processed.
     *
     * @param context The actor context providing access to actor functionality
     */
    default void preStart(ActorContext context) {
        // Default implementation does nothing
    }

    /**
     * Called once after the actor has stopped processing messages.
     *
     * @param context The actor context providing access to actor functionality
     */
    default void postStop(ActorContext context) {
        // Default implementation does nothing
    }

    /**
     * Called when processing a message threw an unexpected exception, before the
     * supervision strategy is applied.
     *
     * @param message   The message that caused the exception
     * @param exception The exception that was thrown
     * @param context   The actor context providing access to actor functionality
     */
    default void onError(Message message, RuntimeException exception, ActorContext context) {
        // Default implementation does nothing
    }
}

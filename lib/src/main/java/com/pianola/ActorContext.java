package com.pianola;

import org.slf4j.Logger;

/**
 * What a handler can see of its own actor while processing a message.
 * Only valid on the actor thread.
 */
public interface ActorContext {

    /**
     * Gets the PID of the current actor.
     *
     * @return The PID of the current actor
     */
    Pid self();

    String getActorId();

    /**
     * Sends a message to another actor without waiting for a reply.
     *
     * @param target  The target actor
     * @param message The message to send
     * @return true if the message was enqueued
     */
    boolean tell(Pid target, Object message);

    /**
     * Answers the request currently being processed. Replies to any other message
     * are ignored.
     *
     * @param request  The request being answered
     * @param response The reply value
     * @param <R>      The reply type
     */
    <R> void reply(Request<R> request, R response);

    /**
     * Returns true if the current message was sent with ask and expects a reply.
     */
    boolean isAsk();

    ActorSystem getSystem();

    /**
     * Gets the logger for this actor, named after the actor class and id.
     */
    Logger getLogger();
}

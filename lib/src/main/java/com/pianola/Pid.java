package com.pianola;

import java.time.Duration;

/**
 * Process ID (Pid) for an actor: an opaque, copyable handle used to send messages to it.
 * Any number of callers may hold the same Pid.
 */
public record Pid(String actorId, ActorSystem system) {

    /**
     * Sends a message to the actor without waiting for a reply.
     *
     * @param message The message to send
     * @return true if the message was enqueued
     */
    public boolean tell(Object message) {
        return system.tell(this, message);
    }

    /**
     * Sends a request to the actor and returns the pending reply.
     *
     * @param request the request
     * @param timeout how long to wait for the reply before failing with {@code TIMEOUT}
     * @param <R> the reply type
     * @return the pending reply
     */
    public <R> Reply<R> ask(Request<R> request, Duration timeout) {
        return system.ask(this, request, timeout);
    }

    /**
     * Returns a string representation of this Pid.
     *
     * @return A string in the format "actorId@local"
     */
    @Override
    public String toString() {
        return actorId + "@local";
    }
}

package com.pianola;

/**
 * Marker for messages that expect a reply of type {@code R}.
 * <p>
 * The type parameter ties a request to its response so that
 * {@link ActorSystem#ask(Pid, Request, java.time.Duration)} and
 * {@link ActorContext#reply(Request, Object)} are checked at compile time.
 *
 * @param <R> the type of the reply
 */
public interface Request<R> {
}

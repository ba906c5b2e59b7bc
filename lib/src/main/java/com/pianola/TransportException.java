package com.pianola;

/**
 * A failure of the ask protocol itself: the request could not be delivered, or no
 * response arrived. Distinct from {@link HandlerException}, which is reported by the
 * handler after the message was delivered.
 */
public class TransportException extends RuntimeException {

    /**
     * What went wrong while delivering the request or waiting for the response.
     */
    public enum Kind {
        /** No actor is registered under the target id. */
        ACTOR_NOT_FOUND,
        /** The target mailbox was closed when the request was enqueued. */
        MAILBOX_CLOSED,
        /** The target mailbox had no room for the request. */
        MAILBOX_FULL,
        /** The actor stopped while the request was still queued. */
        ACTOR_TERMINATED,
        /** No response arrived within the ask timeout. */
        TIMEOUT,
        /** The actor system shut down while the request was pending. */
        SYSTEM_SHUTDOWN
    }

    private final Kind kind;
    private final String actorId;

    public TransportException(Kind kind, String actorId, String message) {
        super(message);
        this.kind = kind;
        this.actorId = actorId;
    }

    public TransportException(Kind kind, String actorId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.actorId = actorId;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the id of the actor the request was addressed to.
     */
    public String getActorId() {
        return actorId;
    }
}

package com.pianola;

/**
 * What an actor does after its handler fails unexpectedly.
 * Failures reported through {@link HandlerException} are regular outcomes and are
 * not subject to supervision. Actors are never restarted.
 */
public enum SupervisionStrategy {
    /**
     * Log the failure, report it to the asker, and keep processing the next message.
     */
    RESUME,

    /**
     * Report the failure to the asker, then stop the actor. Later requests fail with
     * a transport failure because the mailbox is closed.
     */
    STOP
}

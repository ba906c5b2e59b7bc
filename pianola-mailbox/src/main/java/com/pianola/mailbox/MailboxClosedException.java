package com.pianola.mailbox;

/**
 * Thrown when a message is enqueued on a mailbox whose owning actor has stopped.
 */
public class MailboxClosedException extends IllegalStateException {

    public MailboxClosedException(String message) {
        super(message);
    }
}

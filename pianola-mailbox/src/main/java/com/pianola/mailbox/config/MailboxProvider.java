package com.pianola.mailbox.config;

import com.pianola.mailbox.Mailbox;

/**
 * Creates the mailbox an actor will own.
 *
 * @param <M> The type of messages the mailbox holds
 */
@FunctionalInterface
public interface MailboxProvider<M> {

    /**
     * Creates a new mailbox for one actor.
     *
     * @param config the mailbox configuration, or null for defaults
     * @return a new, open mailbox
     */
    Mailbox<M> createMailbox(MailboxConfig config);
}

package com.pianola.mailbox.config;

/**
 * Mailbox implementations selectable through {@link MailboxConfig}.
 */
public enum MailboxType {
    /**
     * {@link com.pianola.mailbox.LinkedMailbox}: bounded by {@link MailboxConfig#getMaxCapacity()}.
     */
    LINKED,

    /**
     * {@link com.pianola.mailbox.MpscMailbox}: unbounded, lock-free enqueue.
     * The capacity and overflow settings do not apply.
     */
    MPSC
}

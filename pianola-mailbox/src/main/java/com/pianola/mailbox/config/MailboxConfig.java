package com.pianola.mailbox.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for actor mailbox settings.
 */
public class MailboxConfig {
    // Default values for mailbox configuration
    public static final int DEFAULT_MAX_CAPACITY = 10_000;
    public static final MailboxType DEFAULT_MAILBOX_TYPE = MailboxType.LINKED;
    public static final OverflowStrategy DEFAULT_OVERFLOW_STRATEGY = OverflowStrategy.BLOCK;
    public static final Duration DEFAULT_ENQUEUE_TIMEOUT = Duration.ofSeconds(5);

    private int maxCapacity;
    private MailboxType mailboxType;
    private OverflowStrategy overflowStrategy;
    private Duration enqueueTimeout;

    /**
     * Creates a new MailboxConfig with default values.
     */
    public MailboxConfig() {
        this.maxCapacity = DEFAULT_MAX_CAPACITY;
        this.mailboxType = DEFAULT_MAILBOX_TYPE;
        this.overflowStrategy = DEFAULT_OVERFLOW_STRATEGY;
        this.enqueueTimeout = DEFAULT_ENQUEUE_TIMEOUT;
    }

    /**
     * Sets the maximum capacity for bounded mailboxes.
     *
     * @param maxCapacity The maximum capacity, must be positive
     * @return This MailboxConfig instance
     */
    public MailboxConfig setMaxCapacity(int maxCapacity) {
        if (maxCapacity <= 0) {
            throw new IllegalArgumentException("Mailbox capacity must be positive: " + maxCapacity);
        }
        this.maxCapacity = maxCapacity;
        return this;
    }

    /**
     * Gets the maximum capacity for the mailbox.
     *
     * @return The maximum capacity
     */
    public int getMaxCapacity() {
        return maxCapacity;
    }

    public MailboxConfig setMailboxType(MailboxType mailboxType) {
        this.mailboxType = Objects.requireNonNull(mailboxType, "mailboxType");
        return this;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    public MailboxConfig setOverflowStrategy(OverflowStrategy overflowStrategy) {
        this.overflowStrategy = Objects.requireNonNull(overflowStrategy, "overflowStrategy");
        return this;
    }

    public OverflowStrategy getOverflowStrategy() {
        return overflowStrategy;
    }

    /**
     * Sets how long a {@link OverflowStrategy#BLOCK} sender waits for space.
     *
     * @param enqueueTimeout the wait bound
     * @return This MailboxConfig instance
     */
    public MailboxConfig setEnqueueTimeout(Duration enqueueTimeout) {
        this.enqueueTimeout = Objects.requireNonNull(enqueueTimeout, "enqueueTimeout");
        return this;
    }

    public Duration getEnqueueTimeout() {
        return enqueueTimeout;
    }

    @Override
    public String toString() {
        return "MailboxConfig{type=" + mailboxType
                + ", maxCapacity=" + maxCapacity
                + ", overflow=" + overflowStrategy
                + ", enqueueTimeout=" + enqueueTimeout + '}';
    }
}

package com.pianola.mailbox.config;

/**
 * Defines how enqueueing behaves when a bounded mailbox is full.
 *
 * <ul>
 *   <li>{@link #BLOCK} - Sender waits up to the configured enqueue timeout for space (default)</li>
 *   <li>{@link #REJECT} - Enqueue fails immediately</li>
 * </ul>
 */
public enum OverflowStrategy {
    /**
     * Block the sender until space is available or the enqueue timeout elapses.
     * This provides natural backpressure to message producers.
     */
    BLOCK,

    /**
     * Fail the enqueue at once when the mailbox is full.
     */
    REJECT
}

package com.pianola.mailbox;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Default mailbox implementation using LinkedBlockingQueue.
 *
 * Recommended for:
 * - General-purpose actor mailboxes
 * - When backpressure/bounded capacity is needed
 *
 * Blocking enqueues wait in short slices so that a concurrent {@link #close()}
 * releases them promptly.
 *
 * @param <T> The type of messages
 */
public class LinkedMailbox<T> implements Mailbox<T> {

    private static final long WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final LinkedBlockingQueue<T> queue;
    private final int capacity;
    private volatile boolean closed = false;

    /**
     * Creates an unbounded mailbox.
     */
    public LinkedMailbox() {
        this.queue = new LinkedBlockingQueue<>();
        this.capacity = Integer.MAX_VALUE;
    }

    /**
     * Creates a bounded mailbox with the specified capacity.
     *
     * @param capacity the maximum number of messages
     */
    public LinkedMailbox(int capacity) {
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.capacity = capacity;
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        ensureOpen();
        return queue.offer(message) && confirmEnqueued(message);
    }

    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        long remaining = unit.toNanos(timeout);
        long deadline = System.nanoTime() + remaining;
        while (true) {
            ensureOpen();
            if (queue.offer(message, Math.min(Math.max(remaining, 0), WAIT_SLICE_NANOS), TimeUnit.NANOSECONDS)) {
                return confirmEnqueued(message);
            }
            remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
        }
    }

    @Override
    public void put(T message) throws InterruptedException {
        Objects.requireNonNull(message, "Message cannot be null");
        while (true) {
            ensureOpen();
            if (queue.offer(message, WAIT_SLICE_NANOS, TimeUnit.NANOSECONDS)) {
                confirmEnqueued(message);
                return;
            }
        }
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    @Override
    public T take() throws InterruptedException {
        return queue.take();
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        return queue.drainTo(collection, maxElements);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int remainingCapacity() {
        return queue.remainingCapacity();
    }

    @Override
    public void clear() {
        queue.clear();
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public int capacity() {
        return capacity;
    }

    private void ensureOpen() {
        if (closed) {
            throw new MailboxClosedException("Mailbox is closed");
        }
    }

    // A close racing with the enqueue must not strand the message behind the final drain.
    private boolean confirmEnqueued(T message) {
        if (closed && queue.remove(message)) {
            throw new MailboxClosedException("Mailbox closed during enqueue");
        }
        return true;
    }
}

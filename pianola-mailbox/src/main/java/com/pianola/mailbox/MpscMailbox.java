package com.pianola.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Mailbox implementation using the JCTools MPSC (Multi-Producer Single-Consumer) queue.
 *
 * This implementation provides:
 * - Lock-free message enqueuing on the queue itself
 * - Minimal allocation overhead
 *
 * Trade-offs:
 * - Blocking dequeue operations (poll with timeout, take) use a lock for waiting
 * - Always unbounded: under sustained overload it grows without limit
 *
 * @param <T> The type of messages
 */
public class MpscMailbox<T> implements Mailbox<T> {

    private final MpscUnboundedArrayQueue<T> queue;
    private final ReentrantLock lock;
    private final Condition notEmpty;
    // Enqueuers share the read side; close() takes the write side so no offer lands after it.
    private final ReentrantReadWriteLock closeLock = new ReentrantReadWriteLock();
    private volatile boolean hasWaitingConsumers = false;
    private volatile boolean closed = false;

    /**
     * Creates an MPSC mailbox with default chunk size (128).
     */
    public MpscMailbox() {
        this(128);
    }

    /**
     * Creates an MPSC mailbox with the specified initial chunk size.
     * The queue is unbounded; the chunk size only tunes allocation.
     *
     * @param chunkSize the initial chunk size, rounded up to a power of 2
     */
    public MpscMailbox(int chunkSize) {
        // JCTools requires at least 2
        int safeCapacity = chunkSize <= 1 ? 2 : chunkSize;
        this.queue = new MpscUnboundedArrayQueue<>(nextPowerOfTwo(safeCapacity));
        this.lock = new ReentrantLock();
        this.notEmpty = lock.newCondition();
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        closeLock.readLock().lock();
        try {
            if (closed) {
                throw new MailboxClosedException("Mailbox is closed");
            }
            queue.offer(message);
        } finally {
            closeLock.readLock().unlock();
        }
        signalNotEmpty();
        return true;
    }

    @Override
    public boolean offer(T message, long timeout, TimeUnit unit) {
        // Unbounded: never waits
        return offer(message);
    }

    @Override
    public void put(T message) {
        offer(message);
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T message = queue.poll();
        if (message != null) {
            return message;
        }
        if (timeout <= 0) {
            return null;
        }

        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            hasWaitingConsumers = true;
            while (true) {
                message = queue.poll();
                if (message != null) {
                    return message;
                }
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            hasWaitingConsumers = false;
            lock.unlock();
        }
    }

    @Override
    public T take() throws InterruptedException {
        T message = queue.poll();
        if (message != null) {
            return message;
        }

        lock.lock();
        try {
            hasWaitingConsumers = true;
            while (true) {
                message = queue.poll();
                if (message != null) {
                    return message;
                }
                notEmpty.await();
            }
        } finally {
            hasWaitingConsumers = false;
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection, int maxElements) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        int count = 0;
        while (count < maxElements) {
            T message = queue.poll();
            if (message == null) {
                break;
            }
            collection.add(message);
            count++;
        }
        return count;
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
        return Integer.MAX_VALUE;
    }

    @Override
    public void clear() {
        queue.clear();
    }

    @Override
    public void close() {
        closeLock.writeLock().lock();
        try {
            closed = true;
        } finally {
            closeLock.writeLock().unlock();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public int capacity() {
        return Integer.MAX_VALUE;
    }

    /**
     * Signals a waiting consumer. Only takes the lock if a consumer might be parked.
     */
    private void signalNotEmpty() {
        if (hasWaitingConsumers) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
    }

    private static int nextPowerOfTwo(int value) {
        if ((value & (value - 1)) == 0) {
            return value;
        }
        int result = 1;
        while (result < value) {
            result <<= 1;
        }
        return result;
    }
}

package com.demo.chathub.infrastructure;

import java.util.ArrayDeque;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded fan-out channel. Every {@link Receiver} gets its own buffer of {@code capacity}
 * events; a slow receiver loses its oldest buffered events and never slows down
 * publishers or other receivers.
 *
 * @param <T> event type
 */
public class BroadcastChannel<T> {

    private final String name;
    private final int capacity;
    private final Set<Receiver> receivers = new CopyOnWriteArraySet<>();
    private final AtomicLong published = new AtomicLong();

    public BroadcastChannel(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
    }

    /**
     * Offer an event to every attached receiver. Never blocks.
     *
     * @return number of receivers the event was offered to
     */
    public int publish(T event) {
        int delivered = 0;
        for (Receiver receiver : receivers) {
            if (receiver.offer(event)) {
                delivered++;
            }
        }
        if (delivered > 0) {
            published.incrementAndGet();
        }
        return delivered;
    }

    /**
     * Attach a new receiver. It only sees events published after this call.
     */
    public Receiver subscribe() {
        Receiver receiver = new Receiver();
        receivers.add(receiver);
        return receiver;
    }

    public int receiverCount() {
        return receivers.size();
    }

    public long publishedCount() {
        return published.get();
    }

    public int getCapacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return "BroadcastChannel{" + name + ", receivers=" + receivers.size() + "}";
    }

    /**
     * One consumer's view of the channel.
     */
    public final class Receiver implements AutoCloseable {

        private final ArrayDeque<T> buffer = new ArrayDeque<>();
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition notEmpty = lock.newCondition();
        private final AtomicLong lagged = new AtomicLong();
        private volatile boolean closed;

        private Receiver() {
        }

        boolean offer(T event) {
            lock.lock();
            try {
                if (closed) {
                    return false;
                }
                if (buffer.size() >= capacity) {
                    buffer.pollFirst();
                    lagged.incrementAndGet();
                }
                buffer.addLast(event);
                notEmpty.signal();
                return true;
            } finally {
                lock.unlock();
            }
        }

        /**
         * Wait for the next event.
         *
         * @return the event, or {@code null} once the receiver is closed
         */
        public T receive() throws InterruptedException {
            lock.lockInterruptibly();
            try {
                while (buffer.isEmpty() && !closed) {
                    notEmpty.await();
                }
                return closed ? null : buffer.pollFirst();
            } finally {
                lock.unlock();
            }
        }

        /**
         * Wait up to {@code timeout} for the next event.
         *
         * @return the event, or {@code null} on timeout or once closed
         */
        public T poll(long timeout, TimeUnit unit) throws InterruptedException {
            long nanos = unit.toNanos(timeout);
            lock.lockInterruptibly();
            try {
                while (buffer.isEmpty() && !closed) {
                    if (nanos <= 0L) {
                        return null;
                    }
                    nanos = notEmpty.awaitNanos(nanos);
                }
                return closed ? null : buffer.pollFirst();
            } finally {
                lock.unlock();
            }
        }

        /**
         * Events dropped from this receiver's buffer because it fell behind.
         */
        public long lagged() {
            return lagged.get();
        }

        public int pending() {
            lock.lock();
            try {
                return buffer.size();
            } finally {
                lock.unlock();
            }
        }

        public boolean isClosed() {
            return closed;
        }

        public BroadcastChannel<T> channel() {
            return BroadcastChannel.this;
        }

        /**
         * Detach from the channel and wake any pending {@link #receive()}. Idempotent.
         */
        @Override
        public void close() {
            receivers.remove(this);
            lock.lock();
            try {
                closed = true;
                buffer.clear();
                notEmpty.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }
}

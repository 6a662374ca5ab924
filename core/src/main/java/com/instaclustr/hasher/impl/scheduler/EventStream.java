package com.instaclustr.hasher.impl.scheduler;

import java.io.Closeable;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import com.instaclustr.hasher.impl.FileEvent;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Multiplexed stream of events of all hashed files, bounded in the number of buffered events.
 *
 * <p>Events of one file are delivered in the order they were sent, events of different files interleave
 * arbitrarily. Producers wait while the stream is full. Closing the stream tells every producer nobody listens
 * anymore.</p>
 */
public class EventStream implements Closeable {

    private static final long OFFER_MILLIS = 50;

    private final BlockingQueue<Envelope> queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public EventStream(final int capacity) {
        checkArgument(capacity > 0, "capacity of event stream has to be greater than 0 but was %s", capacity);
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Events of senders which disconnected in the meantime are skipped.
     *
     * @return next event or null if none arrived within timeout or the stream is closed
     */
    public FileEvent poll(final long timeout, final TimeUnit unit) throws InterruptedException {
        final long deadline = System.nanoTime() + unit.toNanos(timeout);

        while (!closed.get()) {
            final Envelope envelope = queue.poll(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);

            if (envelope == null) {
                return null;
            }

            if (!envelope.disconnected.getAsBoolean()) {
                return envelope.event;
            }
        }

        return null;
    }

    /**
     * @return next event, null if the stream is closed
     */
    public FileEvent take() throws InterruptedException {
        while (!closed.get()) {
            final FileEvent event = poll(OFFER_MILLIS, TimeUnit.MILLISECONDS);

            if (event != null) {
                return event;
            }
        }
        return null;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.clear();
        }
    }

    /**
     * Waits until there is space for the event, the stream is closed or {@code disconnected} turns true. An accepted
     * event is still dropped if {@code disconnected} turns true before it is polled.
     *
     * @return true if the event was accepted
     */
    boolean send(final FileEvent event, final BooleanSupplier disconnected) {
        final Envelope envelope = new Envelope(event, disconnected);

        try {
            while (!closed.get() && !disconnected.getAsBoolean()) {
                if (queue.offer(envelope, OFFER_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    /**
     * Drops buffered events of senders which disconnected, freeing their space for others.
     */
    void purgeDisconnected() {
        queue.removeIf(envelope -> envelope.disconnected.getAsBoolean());
    }

    private static final class Envelope {

        private final FileEvent event;
        private final BooleanSupplier disconnected;

        private Envelope(final FileEvent event, final BooleanSupplier disconnected) {
            this.event = event;
            this.disconnected = disconnected;
        }
    }
}

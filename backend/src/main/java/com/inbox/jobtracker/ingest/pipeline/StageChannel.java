package com.inbox.jobtracker.ingest.pipeline;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Bounded single-producer/single-consumer handoff between two pipeline stages.
 *
 * <p>{@link #send} blocks while the channel is full and {@link #receive} blocks while it is
 * empty. The producer calls {@link #close} once it has nothing more to send; the consumer then
 * sees {@link Optional#empty()} after draining every value sent before the close.
 *
 * <p>A consumer that stops before the end of the stream calls {@link #abandon}; from then on
 * values are discarded so the producer never blocks on a reader that is gone.
 */
public final class StageChannel<T> {
    private static final Object END_OF_STREAM = new Object();

    private final String name;
    private final BlockingQueue<Object> queue;
    private volatile boolean closed;
    private volatile boolean abandoned;
    private boolean exhausted;

    public StageChannel(String name, int capacity) {
        this.name = name;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    public void send(T value) throws InterruptedException {
        Objects.requireNonNull(value, "value");
        if (closed) {
            throw new IllegalStateException("Channel " + name + " is closed");
        }
        if (abandoned) {
            return;
        }
        queue.put(value);
    }

    /**
     * Marks the end of the stream. Safe to call more than once.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (abandoned) {
            return;
        }
        try {
            queue.put(END_OF_STREAM);
        } catch (InterruptedException e) {
            // Producer is being cancelled; the consumer is gone or about to be.
            Thread.currentThread().interrupt();
            queue.offer(END_OF_STREAM);
        }
    }

    @SuppressWarnings("unchecked")
    public Optional<T> receive() throws InterruptedException {
        if (exhausted) {
            return Optional.empty();
        }
        Object next = queue.take();
        if (next == END_OF_STREAM) {
            exhausted = true;
            return Optional.empty();
        }
        return Optional.of((T) next);
    }

    /**
     * Called by the consumer when it will not read any further. Drops buffered values and
     * wakes a producer blocked in {@link #send}.
     */
    public void abandon() {
        abandoned = true;
        queue.clear();
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isAbandoned() {
        return abandoned;
    }
}

package com.herotasks.realtime.infrastructure;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Bounded inbound queue for one connection, drained by its own task.
 *
 * The transport thread calls {@link #offer}; when the queue is full it waits
 * up to the offer timeout and then drops the frame. {@link #close} stops the
 * drain task and discards anything still queued.
 */
@Slf4j
public class ConnectionInbox {

    private final String userId;
    private final String connectionId;
    private final BlockingQueue<byte[]> queue;
    private final Duration offerTimeout;
    private final Consumer<byte[]> consumer;

    private volatile boolean closed;
    private volatile Future<?> worker;

    public ConnectionInbox(String userId,
                           String connectionId,
                           int capacity,
                           Duration offerTimeout,
                           Consumer<byte[]> consumer) {
        this.userId = userId;
        this.connectionId = connectionId;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.offerTimeout = offerTimeout;
        this.consumer = consumer;
    }

    public void start(ExecutorService executor) {
        worker = executor.submit(this::drain);
    }

    public boolean offer(byte[] frame) {
        if (closed) {
            return false;
        }
        try {
            boolean accepted = queue.offer(frame, offerTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!accepted) {
                log.warn("Inbox full, dropping frame: userId={}, wsId={}, capacity={}",
                        userId, connectionId, queue.size());
            }
            return accepted;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void close() {
        closed = true;
        queue.clear();
        Future<?> current = worker;
        if (current != null) {
            current.cancel(true);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public int pending() {
        return queue.size();
    }

    private void drain() {
        try {
            while (!closed) {
                byte[] frame = queue.take();
                try {
                    consumer.accept(frame);
                } catch (RuntimeException e) {
                    log.error("Error dispatching inbound frame: userId={}, wsId={}", userId, connectionId, e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Inbox drained and stopped: userId={}, wsId={}", userId, connectionId);
    }
}

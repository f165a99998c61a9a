/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.broker;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off between a broker consumer and its subscription loop.
 *
 * <p>{@link #put} blocks while the channel is full, which is the only throttle on consumption.
 * After {@link #close()} no new deliveries are accepted; {@link #take()} keeps returning buffered
 * deliveries and then {@code null}.</p>
 */
public final class DeliveryChannel {

    private static final long POLL_INTERVAL_MS = 200;

    private final BlockingQueue<InboundMessage> queue;
    private final int capacity;
    private volatile boolean closed;

    public DeliveryChannel(int capacity) {
        this(checkCapacity(capacity), new ArrayBlockingQueue<>(capacity));
    }

    DeliveryChannel(int capacity, BlockingQueue<InboundMessage> queue) {
        this.capacity = capacity;
        this.queue = queue;
    }

    private static int checkCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        return capacity;
    }

    /**
     * Push a delivery, waiting for space.
     *
     * @return {@code false} if the channel was closed before the delivery could be queued
     */
    public boolean put(InboundMessage message) throws InterruptedException {
        while (!closed) {
            if (queue.offer(message, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                // a reader may already have seen the channel closed and empty
                return !closed || !queue.remove(message);
            }
        }
        return false;
    }

    /**
     * Next delivery, waiting for one to arrive.
     *
     * @return {@code null} once the channel is closed and drained
     */
    public InboundMessage take() throws InterruptedException {
        while (true) {
            InboundMessage message = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            if (message != null) return message;
            if (closed && queue.isEmpty()) return null;
        }
    }

    public void close() { closed = true; }

    public boolean isClosed() { return closed; }

    public int size() { return queue.size(); }

    public int capacity() { return capacity; }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.core;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Publish/subscribe access to the broker.
 *
 * <p>Synchronous sends block until the broker has stored the message and throw
 * {@link com.mqfacade.common.exception.SendException} on failure. Asynchronous sends return
 * immediately; their failures are only logged.</p>
 *
 * <p>Subscriptions deliver at least once. Each delivery is handled on its own thread, and a
 * failing listener is retried according to the subscription's {@link AckMode}.</p>
 */
public interface MessageClient extends AutoCloseable {

    /** Send a message. Returns the broker-assigned message id. */
    String send(String topic, String message);

    /** Send a message that becomes visible to consumers after {@code delay}. */
    String sendDelay(String topic, String message, Duration delay);

    /** Send a message that becomes visible to consumers at {@code deliverAt}. */
    String sendDelayAt(String topic, String message, Instant deliverAt);

    void sendAsync(String topic, String message);

    void sendDelayAsync(String topic, String message, Duration delay);

    void sendDelayAtAsync(String topic, String message, Instant deliverAt);

    /**
     * Start a subscription without blocking the caller.
     *
     * @return completes once the broker consumer is open and the options are registered;
     *         completes exceptionally with {@link com.mqfacade.common.exception.SubscribeException}
     *         if the broker rejects the subscription
     */
    CompletableFuture<Void> subscribe(ConsumerOptions options);

    /** Start several subscriptions; see {@link #subscribe(ConsumerOptions)}. */
    CompletableFuture<Void> subscribes(ConsumerOptions... options);

    ConnectionState getState();

    /** Close the broker connection. Running subscriptions end once their channels drain. */
    @Override
    void close();
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.broker;

import java.util.concurrent.CompletableFuture;

/**
 * One live broker connection, shared by every producer and consumer of the process.
 */
public interface BrokerClient extends AutoCloseable {

    /**
     * Open a consumer that pushes each delivery into {@code channel}. The adapter blocks while the
     * channel is full and closes the channel when the consumer or the client is closed.
     */
    BrokerConsumer subscribe(BrokerSubscribeRequest request, DeliveryChannel channel) throws BrokerException;

    /** Send and wait for the broker's receipt. Returns the message id. */
    String send(String topic, byte[] payload, SendOptions options) throws BrokerException;

    /** Send without waiting. The future carries the message id or the failure. */
    CompletableFuture<String> sendAsync(String topic, byte[] payload, SendOptions options);

    @Override
    void close();
}

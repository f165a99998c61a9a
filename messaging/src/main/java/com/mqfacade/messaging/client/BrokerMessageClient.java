/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.client;

import com.mqfacade.common.exception.SendException;
import com.mqfacade.messaging.broker.BrokerClient;
import com.mqfacade.messaging.broker.BrokerException;
import com.mqfacade.messaging.broker.SendOptions;
import com.mqfacade.messaging.codec.Codec;
import com.mqfacade.messaging.codec.CodecException;
import com.mqfacade.messaging.consumer.SubscriptionLoop;
import com.mqfacade.messaging.consumer.SubscriptionRegistry;
import com.mqfacade.messaging.core.ConnectionState;
import com.mqfacade.messaging.core.ConsumerOptions;
import com.mqfacade.messaging.core.MessageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link MessageClient} over whatever {@link BrokerClient} the {@link ConnectionManager} holds.
 *
 * <p>Each subscription runs a {@link SubscriptionLoop} on its own thread; each delivery is handled
 * on a thread of an unbounded dispatch pool. The only throttle on consumption is the bounded
 * delivery channel of each subscription.</p>
 */
public class BrokerMessageClient implements MessageClient {

    private static final Logger log = LoggerFactory.getLogger(BrokerMessageClient.class);

    private final ConnectionManager connectionManager;
    private final ClientHandle handle;
    private final SubscriptionRegistry registry;
    private final Codec codec;
    private final ExecutorService subscriptionExecutor;
    private final ExecutorService dispatchExecutor;
    private volatile ConnectionState state;

    /**
     * @throws com.mqfacade.common.exception.ClientInitializationException if the broker is unreachable
     */
    public BrokerMessageClient(ConnectionManager connectionManager, ClientSettings settings, Codec codec) {
        this.connectionManager = connectionManager;
        this.handle = connectionManager.getOrCreateClient(settings);
        this.registry = connectionManager.registry();
        this.codec = codec;
        this.subscriptionExecutor = Executors.newCachedThreadPool(daemonThreads("mq-subscription-"));
        this.dispatchExecutor = Executors.newCachedThreadPool(daemonThreads("mq-dispatch-"));
        this.state = ConnectionState.CONNECTED;
    }

    // ==================== Publishing ====================

    @Override
    public String send(String topic, String message) {
        return doSend(topic, message, SendOptions.immediate());
    }

    @Override
    public String sendDelay(String topic, String message, Duration delay) {
        return doSend(topic, message, SendOptions.deliverAfter(delay));
    }

    @Override
    public String sendDelayAt(String topic, String message, Instant deliverAt) {
        return doSend(topic, message, SendOptions.deliverAt(deliverAt));
    }

    @Override
    public void sendAsync(String topic, String message) {
        doSendAsync(topic, message, SendOptions.immediate());
    }

    @Override
    public void sendDelayAsync(String topic, String message, Duration delay) {
        doSendAsync(topic, message, SendOptions.deliverAfter(delay));
    }

    @Override
    public void sendDelayAtAsync(String topic, String message, Instant deliverAt) {
        doSendAsync(topic, message, SendOptions.deliverAt(deliverAt));
    }

    private String doSend(String topic, String message, SendOptions options) {
        ensureOpen();
        try {
            String messageId = handle.broker().send(topic, codec.encode(message), options);
            log.debug("Sent to {} as {} ({})", topic, messageId, options);
            return messageId;
        } catch (BrokerException | CodecException e) {
            log.error("Send to {} failed", topic, e);
            throw new SendException(topic, e);
        }
    }

    private void doSendAsync(String topic, String message, SendOptions options) {
        ensureOpen();
        byte[] payload;
        try {
            payload = codec.encode(message);
        } catch (CodecException e) {
            log.error("Async send to {} dropped, message cannot be encoded", topic, e);
            return;
        }
        handle.broker().sendAsync(topic, payload, options).whenComplete((messageId, ex) -> {
            if (ex != null) {
                log.error("Async send to {} failed", topic, ex);
            } else {
                log.debug("Async sent to {} as {} ({})", topic, messageId, options);
            }
        });
    }

    // ==================== Subscribing ====================

    @Override
    public CompletableFuture<Void> subscribe(ConsumerOptions options) {
        ensureOpen();
        CompletableFuture<Void> registered = new CompletableFuture<>();
        subscriptionExecutor.execute(new SubscriptionLoop(options, handle.broker(), handle.newConsumerName(),
                registry, codec, dispatchExecutor, registered));
        return registered;
    }

    @Override
    public CompletableFuture<Void> subscribes(ConsumerOptions... options) {
        return CompletableFuture.allOf(Arrays.stream(options)
                .map(this::subscribe)
                .toArray(CompletableFuture[]::new));
    }

    // ==================== Lifecycle ====================

    @Override
    public ConnectionState getState() { return state; }

    public SubscriptionRegistry getRegistry() { return registry; }

    @Override
    public synchronized void close() {
        if (state != ConnectionState.CONNECTED) return;
        state = ConnectionState.CLOSING;
        connectionManager.close();
        subscriptionExecutor.shutdown();
        dispatchExecutor.shutdown();
        state = ConnectionState.CLOSED;
        log.info("Message client closed");
    }

    private void ensureOpen() {
        if (state != ConnectionState.CONNECTED) {
            throw new IllegalStateException("Message client is " + state);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

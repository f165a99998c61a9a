/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.consumer;

import com.mqfacade.common.exception.SubscribeException;
import com.mqfacade.messaging.broker.*;
import com.mqfacade.messaging.codec.Codec;
import com.mqfacade.messaging.core.ConsumerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Control loop of one subscription. Runs on its own thread for the lifetime of the subscription.
 *
 * <ol>
 *   <li>normalize the options (retry limit and channel size defaults)</li>
 *   <li>open a broker consumer feeding a bounded {@link DeliveryChannel}</li>
 *   <li>store the options in the {@link SubscriptionRegistry}</li>
 *   <li>hand every delivery to the dispatch executor without waiting for it</li>
 * </ol>
 *
 * The loop ends when the channel is closed by the broker adapter or the thread is interrupted.
 * A rejected subscribe ends it immediately; the registration future carries the error.
 */
public class SubscriptionLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionLoop.class);

    public static final Duration NACK_REDELIVERY_DELAY = Duration.ofSeconds(15);

    private final ConsumerOptions options;
    private final BrokerClient broker;
    private final String consumerName;
    private final SubscriptionRegistry registry;
    private final Codec codec;
    private final Executor dispatchExecutor;
    private final CompletableFuture<Void> registered;

    public SubscriptionLoop(ConsumerOptions options, BrokerClient broker, String consumerName,
                            SubscriptionRegistry registry, Codec codec, Executor dispatchExecutor,
                            CompletableFuture<Void> registered) {
        this.options = options;
        this.broker = broker;
        this.consumerName = consumerName;
        this.registry = registry;
        this.codec = codec;
        this.dispatchExecutor = dispatchExecutor;
        this.registered = registered;
    }

    @Override
    public void run() {
        ConsumerOptions effective = options.normalized();
        log.info("Subscribing with {} as consumer {}", effective, consumerName);

        DeliveryChannel channel = new DeliveryChannel(effective.getMaxMessageChannelSize());
        BrokerSubscribeRequest request = new BrokerSubscribeRequest(
                effective.getTopic(),
                effective.getSubscriptionName(),
                effective.getSubscriptionType(),
                consumerName,
                NACK_REDELIVERY_DELAY,
                effective.getMaxMessageChannelSize());

        BrokerConsumer consumer;
        try {
            consumer = broker.subscribe(request, channel);
        } catch (BrokerException | RuntimeException e) {
            log.error("Subscribe error for {}", effective.key(), e);
            registered.completeExceptionally(
                    new SubscribeException(effective.getTopic(), effective.getSubscriptionName(), e));
            return;
        }

        registry.store(effective);
        registered.complete(null);

        long dispatched = 0;
        try {
            InboundMessage message;
            while ((message = channel.take()) != null) {
                dispatchExecutor.execute(new MessageDispatcher(message, consumer, codec, effective, registry));
                dispatched++;
            }
            log.info("Delivery channel of {} closed after {} messages", effective.key(), dispatched);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Subscription loop of {} interrupted after {} messages", effective.key(), dispatched);
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch executor shut down, stopping subscription loop of {}", effective.key());
        }
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.pulsar;

import com.mqfacade.messaging.broker.BrokerClient;
import com.mqfacade.messaging.broker.BrokerConsumer;
import com.mqfacade.messaging.broker.BrokerException;
import com.mqfacade.messaging.broker.BrokerSubscribeRequest;
import com.mqfacade.messaging.broker.DeliveryChannel;
import com.mqfacade.messaging.broker.SendOptions;
import com.mqfacade.messaging.core.SubscriptionType;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.MessageId;
import org.apache.pulsar.client.api.Producer;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.apache.pulsar.client.api.TypedMessageBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * {@link BrokerClient} over one {@link PulsarClient}.
 *
 * <p>Consumers push deliveries from Pulsar's listener threads into the subscription's
 * {@link DeliveryChannel}, blocking while it is full. Producers are created lazily, one per
 * topic, and reused.</p>
 */
public class PulsarBrokerClient implements BrokerClient {

    private static final Logger log = LoggerFactory.getLogger(PulsarBrokerClient.class);

    private final PulsarClient client;
    private final Map<String, Producer<byte[]>> producers = new ConcurrentHashMap<>();
    private final List<PulsarBrokerConsumer> consumers = new CopyOnWriteArrayList<>();

    PulsarBrokerClient(PulsarClient client) {
        this.client = client;
    }

    // ==================== Consuming ====================

    @Override
    public BrokerConsumer subscribe(BrokerSubscribeRequest request, DeliveryChannel channel) throws BrokerException {
        try {
            Consumer<byte[]> consumer = client.newConsumer()
                    .topic(request.topic())
                    .subscriptionName(request.subscriptionName())
                    .subscriptionType(toPulsar(request.subscriptionType()))
                    .consumerName(request.consumerName())
                    .negativeAckRedeliveryDelay(request.negativeAckRedeliveryDelay().toMillis(), TimeUnit.MILLISECONDS)
                    .receiverQueueSize(request.receiverQueueSize())
                    .messageListener((c, msg) -> forward(c, msg, channel))
                    .subscribe();
            PulsarBrokerConsumer brokerConsumer = new PulsarBrokerConsumer(consumer, channel);
            consumers.add(brokerConsumer);
            log.info("Pulsar consumer {} subscribed to {} as {}", request.consumerName(), request.topic(),
                    request.subscriptionName());
            return brokerConsumer;
        } catch (PulsarClientException e) {
            throw new BrokerException("Subscribe to " + request.topic() + " failed", e);
        }
    }

    private void forward(Consumer<byte[]> consumer, Message<byte[]> msg, DeliveryChannel channel) {
        try {
            if (!channel.put(PulsarBrokerConsumer.toInbound(consumer, msg))) {
                log.debug("Delivery channel closed, dropping {} for redelivery", msg.getMessageId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            consumer.negativeAcknowledge(msg);
        }
    }

    static org.apache.pulsar.client.api.SubscriptionType toPulsar(SubscriptionType type) {
        return switch (type) {
            case EXCLUSIVE -> org.apache.pulsar.client.api.SubscriptionType.Exclusive;
            case SHARED -> org.apache.pulsar.client.api.SubscriptionType.Shared;
            case FAILOVER -> org.apache.pulsar.client.api.SubscriptionType.Failover;
            case KEY_SHARED -> org.apache.pulsar.client.api.SubscriptionType.Key_Shared;
        };
    }

    // ==================== Producing ====================

    @Override
    public String send(String topic, byte[] payload, SendOptions options) throws BrokerException {
        try {
            return newMessage(producer(topic), payload, options).send().toString();
        } catch (PulsarClientException e) {
            throw new BrokerException("Send to " + topic + " failed", e);
        }
    }

    @Override
    public CompletableFuture<String> sendAsync(String topic, byte[] payload, SendOptions options) {
        try {
            return newMessage(producer(topic), payload, options).sendAsync().thenApply(MessageId::toString);
        } catch (BrokerException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static TypedMessageBuilder<byte[]> newMessage(Producer<byte[]> producer, byte[] payload,
                                                          SendOptions options) {
        TypedMessageBuilder<byte[]> builder = producer.newMessage().value(payload);
        if (options.deliverAfter() != null) {
            builder.deliverAfter(options.deliverAfter().toMillis(), TimeUnit.MILLISECONDS);
        } else if (options.deliverAt() != null) {
            builder.deliverAt(options.deliverAt().toEpochMilli());
        }
        return builder;
    }

    private Producer<byte[]> producer(String topic) throws BrokerException {
        Producer<byte[]> producer = producers.get(topic);
        if (producer != null) return producer;
        synchronized (producers) {
            producer = producers.get(topic);
            if (producer == null) {
                try {
                    producer = client.newProducer().topic(topic).create();
                } catch (PulsarClientException e) {
                    throw new BrokerException("Cannot create producer for " + topic, e);
                }
                producers.put(topic, producer);
                log.info("Pulsar producer created for {}", topic);
            }
            return producer;
        }
    }

    // ==================== Lifecycle ====================

    @Override
    public void close() {
        consumers.forEach(PulsarBrokerConsumer::close);
        consumers.clear();
        for (Producer<byte[]> producer : producers.values()) {
            try {
                producer.close();
            } catch (PulsarClientException e) {
                log.warn("Error closing Pulsar producer for {}", producer.getTopic(), e);
            }
        }
        producers.clear();
        try {
            client.close();
            log.info("Pulsar client closed");
        } catch (PulsarClientException e) {
            log.warn("Error closing Pulsar client", e);
        }
    }
}

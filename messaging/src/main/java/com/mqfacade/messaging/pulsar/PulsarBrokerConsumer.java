/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.pulsar;

import com.mqfacade.messaging.broker.BrokerConsumer;
import com.mqfacade.messaging.broker.BrokerException;
import com.mqfacade.messaging.broker.DeliveryChannel;
import com.mqfacade.messaging.broker.InboundMessage;
import org.apache.pulsar.client.api.Consumer;
import org.apache.pulsar.client.api.Message;
import org.apache.pulsar.client.api.MessageId;
import org.apache.pulsar.client.api.PulsarClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Pulsar consumer paired with the delivery channel its message listener feeds.
 */
public class PulsarBrokerConsumer implements BrokerConsumer {

    private static final Logger log = LoggerFactory.getLogger(PulsarBrokerConsumer.class);

    private final Consumer<byte[]> consumer;
    private final DeliveryChannel channel;

    PulsarBrokerConsumer(Consumer<byte[]> consumer, DeliveryChannel channel) {
        this.consumer = consumer;
        this.channel = channel;
    }

    static InboundMessage toInbound(Consumer<byte[]> consumer, Message<byte[]> msg) {
        return new InboundMessage(
                consumer.getTopic(),
                consumer.getSubscription(),
                msg.getMessageId(),
                msg.getData(),
                msg.getRedeliveryCount(),
                Instant.ofEpochMilli(msg.getPublishTime()),
                msg.getProducerName());
    }

    @Override
    public void acknowledge(InboundMessage message) throws BrokerException {
        try {
            consumer.acknowledge((MessageId) message.getMessageId());
        } catch (PulsarClientException e) {
            throw new BrokerException("Acknowledge failed for " + message.getMessageId(), e);
        }
    }

    @Override
    public void negativeAcknowledge(InboundMessage message) {
        consumer.negativeAcknowledge((MessageId) message.getMessageId());
    }

    @Override
    public void close() {
        channel.close();
        try {
            consumer.close();
        } catch (PulsarClientException e) {
            log.warn("Error closing Pulsar consumer {} of {}", consumer.getConsumerName(), consumer.getTopic(), e);
        }
    }
}

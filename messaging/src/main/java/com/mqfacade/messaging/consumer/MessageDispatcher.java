/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.consumer;

import com.mqfacade.messaging.broker.BrokerConsumer;
import com.mqfacade.messaging.broker.BrokerException;
import com.mqfacade.messaging.broker.InboundMessage;
import com.mqfacade.messaging.codec.Codec;
import com.mqfacade.messaging.codec.CodecException;
import com.mqfacade.messaging.core.AckMode;
import com.mqfacade.messaging.core.ConsumeResult;
import com.mqfacade.messaging.core.ConsumerMessage;
import com.mqfacade.messaging.core.ConsumerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Handles one delivery: decode, call the listener, then acknowledge or negatively acknowledge.
 *
 * <p>Every delivery ends in exactly one acknowledge or negative-acknowledge. Anything thrown by the
 * listener or the codec counts as a listener failure.</p>
 *
 * <p>On failure the retry settings come from the {@link SubscriptionRegistry}, looked up per message
 * by the loop's topic and the subscription name the broker stamped on the delivery.</p>
 */
public class MessageDispatcher implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    private final InboundMessage message;
    private final BrokerConsumer consumer;
    private final Codec codec;
    private final ConsumerOptions options;
    private final SubscriptionRegistry registry;

    public MessageDispatcher(InboundMessage message, BrokerConsumer consumer, Codec codec,
                             ConsumerOptions options, SubscriptionRegistry registry) {
        this.message = message;
        this.consumer = consumer;
        this.codec = codec;
        this.options = options;
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsumeResult result;
        try {
            result = invokeListener();
        } catch (Throwable t) {
            log.error("Listener crashed on message {} (subscription={}, redeliveryCount={})",
                    message.getMessageId(), message.getSubscriptionName(), message.getRedeliveryCount(), t);
            result = ConsumeResult.failure("listener crashed: " + t, t);
        }
        complete(result);
    }

    /** Decides the outcome for a finished listener call and tells the broker. */
    DispatchOutcome complete(ConsumeResult result) {
        DispatchOutcome outcome = result.isSuccess() ? DispatchOutcome.ACKNOWLEDGE : onFailure(result);
        if (outcome == DispatchOutcome.ACKNOWLEDGE) {
            try {
                consumer.acknowledge(message);
            } catch (BrokerException | RuntimeException e) {
                log.error("Acknowledge failed for message {} (subscription={})",
                        message.getMessageId(), message.getSubscriptionName(), e);
            }
        } else {
            try {
                consumer.negativeAcknowledge(message);
            } catch (RuntimeException e) {
                log.error("Negative acknowledge failed for message {} (subscription={})",
                        message.getMessageId(), message.getSubscriptionName(), e);
            }
        }
        return outcome;
    }

    private ConsumeResult invokeListener() throws Exception {
        log.info("Consuming message: subscription={}, msgId={}, redeliveryCount={}, publishTime={}, producer={}",
                message.getSubscriptionName(), message.getMessageId(), message.getRedeliveryCount(),
                message.getPublishTime(), message.getProducerName());

        String value;
        try {
            value = codec.decode(message.getPayload());
            log.debug("Decoded message {}: {}", message.getMessageId(), value);
        } catch (CodecException e) {
            log.warn("Cannot decode message {}, passing empty value to listener: {}",
                    message.getMessageId(), e.getMessage());
            value = "";
        }

        ConsumerMessage consumerMessage = new ConsumerMessage(value, message.getRedeliveryCount(),
                message.getTopic(), message.getSubscriptionName(), String.valueOf(message.getMessageId()),
                message.getPublishTime(), message.getPayload());
        ConsumeResult result = options.getMessageListener().onMessage(consumerMessage);
        return result != null ? result : ConsumeResult.failure("listener returned no result");
    }

    private DispatchOutcome onFailure(ConsumeResult result) {
        log.error("Consumer error on message {} (subscription={}): {}",
                message.getMessageId(), message.getSubscriptionName(), result.getDetail());

        Optional<ConsumerOptions> stored = registry.lookup(options.getTopic(), message.getSubscriptionName());
        int retryTimes = 0;
        AckMode ackMode = AckMode.ALWAYS_ACK;
        if (stored.isPresent()) {
            retryTimes = RetryPolicy.clamp(stored.get().getRetryTimes());
            ackMode = stored.get().getAckMode();
        } else {
            log.error("No consumer options registered for {}",
                    ConsumerOptions.key(options.getTopic(), message.getSubscriptionName()));
        }

        int redeliveryCount = message.getRedeliveryCount();
        DispatchOutcome outcome = RetryPolicy.decide(ackMode, redeliveryCount, retryTimes);
        if (outcome == DispatchOutcome.NEGATIVE_ACKNOWLEDGE) {
            log.info("Consumer error, retrying: subscription={}, msgId={}, retryTimes={}, redeliveryCount={}, ackMode={}",
                    message.getSubscriptionName(), message.getMessageId(), retryTimes, redeliveryCount, ackMode);
        } else {
            log.info("Consumer error, not retrying: subscription={}, msgId={}, retryTimes={}, redeliveryCount={}, ackMode={}",
                    message.getSubscriptionName(), message.getMessageId(), retryTimes, redeliveryCount, ackMode);
        }
        return outcome;
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.broker;

import java.time.Instant;

/**
 * A message as delivered by the broker. Read-only; ownership returns to the broker once it is
 * acknowledged or negatively acknowledged.
 */
public class InboundMessage {

    private final String topic;
    private final String subscriptionName;
    private final Object messageId;
    private final byte[] payload;
    private final int redeliveryCount;
    private final Instant publishTime;
    private final String producerName;

    public InboundMessage(String topic, String subscriptionName, Object messageId, byte[] payload,
                          int redeliveryCount, Instant publishTime, String producerName) {
        this.topic = topic;
        this.subscriptionName = subscriptionName;
        this.messageId = messageId;
        this.payload = payload;
        this.redeliveryCount = redeliveryCount;
        this.publishTime = publishTime;
        this.producerName = producerName;
    }

    public String getTopic() { return topic; }
    public String getSubscriptionName() { return subscriptionName; }
    /** Broker-specific identifier, opaque to everything but the adapter that created it. */
    public Object getMessageId() { return messageId; }
    public byte[] getPayload() { return payload; }
    public int getRedeliveryCount() { return redeliveryCount; }
    public Instant getPublishTime() { return publishTime; }
    public String getProducerName() { return producerName; }

    @Override
    public String toString() {
        return "InboundMessage{id=" + messageId + ", topic=" + topic + ", subscription=" + subscriptionName
                + ", redeliveryCount=" + redeliveryCount + "}";
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.core;

import java.time.Instant;

/**
 * Message handed to a {@link MessageListener}: the decoded value plus the delivery metadata
 * a listener needs to make its own retry-aware decisions.
 */
public class ConsumerMessage {

    private final String value;
    private final int redeliveryCount;
    private final String topic;
    private final String subscriptionName;
    private final String messageId;
    private final Instant publishTime;
    private final byte[] payload;

    public ConsumerMessage(String value, int redeliveryCount, String topic, String subscriptionName,
                           String messageId, Instant publishTime, byte[] payload) {
        this.value = value;
        this.redeliveryCount = redeliveryCount;
        this.topic = topic;
        this.subscriptionName = subscriptionName;
        this.messageId = messageId;
        this.publishTime = publishTime;
        this.payload = payload;
    }

    /** Decoded value; empty when the payload could not be decoded. */
    public String getValue() { return value; }
    public int getRedeliveryCount() { return redeliveryCount; }
    public String getTopic() { return topic; }
    public String getSubscriptionName() { return subscriptionName; }
    public String getMessageId() { return messageId; }
    public Instant getPublishTime() { return publishTime; }
    /** Raw bytes as delivered by the broker. */
    public byte[] getPayload() { return payload; }

    @Override
    public String toString() {
        return "ConsumerMessage{id=" + messageId + ", subscription=" + subscriptionName
                + ", redeliveryCount=" + redeliveryCount + "}";
    }
}

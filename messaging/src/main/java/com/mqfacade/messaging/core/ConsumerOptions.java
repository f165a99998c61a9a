/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.core;

import java.util.Objects;

/**
 * Configuration of one subscription: where to consume from, how the broker fans messages out,
 * what to do when the listener fails, and how many deliveries may be buffered.
 *
 * <p>Instances are immutable. Options are normalized when the subscription starts
 * ({@link #normalized()}): a retry limit of 0 becomes {@link #MAX_RETRY_TIMES}, any larger
 * limit is clamped to it, and a channel size of 0 becomes {@link #DEFAULT_MESSAGE_CHANNEL_SIZE}.</p>
 *
 * <pre>{@code
 *   ConsumerOptions options = ConsumerOptions.builder()
 *       .topic("orders")
 *       .subscriptionName("billing")
 *       .subscriptionType(SubscriptionType.SHARED)
 *       .ackMode(AckMode.ACK_WITH_RETRY)
 *       .retryTimes(3)
 *       .messageListener(msg -> ConsumeResult.success())
 *       .build();
 * }</pre>
 */
public final class ConsumerOptions {

    /** Upper bound for {@link #getRetryTimes()}, also used when no limit is configured. */
    public static final int MAX_RETRY_TIMES = 50;
    public static final int DEFAULT_MESSAGE_CHANNEL_SIZE = 200;

    private final String topic;
    private final String subscriptionName;
    private final SubscriptionType subscriptionType;
    private final AckMode ackMode;
    private final int retryTimes;
    private final int maxMessageChannelSize;
    private final MessageListener messageListener;

    private ConsumerOptions(Builder b) {
        this.topic = b.topic;
        this.subscriptionName = b.subscriptionName;
        this.subscriptionType = b.subscriptionType;
        this.ackMode = b.ackMode;
        this.retryTimes = b.retryTimes;
        this.maxMessageChannelSize = b.maxMessageChannelSize;
        this.messageListener = b.messageListener;
    }

    public String getTopic() { return topic; }
    public String getSubscriptionName() { return subscriptionName; }
    public SubscriptionType getSubscriptionType() { return subscriptionType; }
    public AckMode getAckMode() { return ackMode; }
    public int getRetryTimes() { return retryTimes; }
    public int getMaxMessageChannelSize() { return maxMessageChannelSize; }
    public MessageListener getMessageListener() { return messageListener; }

    /** Registry key of this subscription. */
    public String key() {
        return key(topic, subscriptionName);
    }

    public static String key(String topic, String subscriptionName) {
        return topic + ":" + subscriptionName;
    }

    /**
     * Copy with defaults applied and the retry limit clamped.
     */
    public ConsumerOptions normalized() {
        int retries = retryTimes == 0 ? MAX_RETRY_TIMES : Math.min(retryTimes, MAX_RETRY_TIMES);
        int channel = maxMessageChannelSize == 0 ? DEFAULT_MESSAGE_CHANNEL_SIZE : maxMessageChannelSize;
        if (retries == retryTimes && channel == maxMessageChannelSize) return this;
        return toBuilder().retryTimes(retries).maxMessageChannelSize(channel).build();
    }

    public Builder toBuilder() {
        return builder()
                .topic(topic)
                .subscriptionName(subscriptionName)
                .subscriptionType(subscriptionType)
                .ackMode(ackMode)
                .retryTimes(retryTimes)
                .maxMessageChannelSize(maxMessageChannelSize)
                .messageListener(messageListener);
    }

    @Override
    public String toString() {
        return "ConsumerOptions{topic=" + topic + ", subscriptionName=" + subscriptionName
                + ", subscriptionType=" + subscriptionType + ", ackMode=" + ackMode
                + ", retryTimes=" + retryTimes + ", maxMessageChannelSize=" + maxMessageChannelSize + "}";
    }

    // ========== Builder ==========

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private String topic;
        private String subscriptionName;
        private SubscriptionType subscriptionType = SubscriptionType.EXCLUSIVE;
        private AckMode ackMode = AckMode.ALWAYS_ACK;
        private int retryTimes;
        private int maxMessageChannelSize;
        private MessageListener messageListener;

        public Builder topic(String topic) {
            this.topic = topic; return this;
        }
        public Builder subscriptionName(String subscriptionName) {
            this.subscriptionName = subscriptionName; return this;
        }
        public Builder subscriptionType(SubscriptionType subscriptionType) {
            this.subscriptionType = subscriptionType; return this;
        }
        public Builder ackMode(AckMode ackMode) {
            this.ackMode = ackMode; return this;
        }
        public Builder retryTimes(int retryTimes) {
            this.retryTimes = retryTimes; return this;
        }
        public Builder maxMessageChannelSize(int size) {
            this.maxMessageChannelSize = size; return this;
        }
        public Builder messageListener(MessageListener listener) {
            this.messageListener = listener; return this;
        }

        public ConsumerOptions build() {
            if (topic == null || topic.isBlank()) {
                throw new IllegalStateException("topic is required");
            }
            if (subscriptionName == null || subscriptionName.isBlank()) {
                throw new IllegalStateException("subscriptionName is required");
            }
            Objects.requireNonNull(subscriptionType, "subscriptionType");
            Objects.requireNonNull(ackMode, "ackMode");
            Objects.requireNonNull(messageListener, "messageListener");
            if (retryTimes < 0) {
                throw new IllegalStateException("retryTimes must not be negative: " + retryTimes);
            }
            if (maxMessageChannelSize < 0) {
                throw new IllegalStateException("maxMessageChannelSize must not be negative: " + maxMessageChannelSize);
            }
            return new ConsumerOptions(this);
        }
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.broker;

import com.mqfacade.messaging.core.SubscriptionType;

import java.time.Duration;

/**
 * Parameters the broker needs to open a consumer.
 *
 * @param topic                      topic to consume
 * @param subscriptionName           durable subscription name
 * @param subscriptionType           fan-out policy among consumers of the subscription
 * @param consumerName               unique name of this consumer instance
 * @param negativeAckRedeliveryDelay how long the broker waits before redelivering a nacked message
 * @param receiverQueueSize          broker-side prefetch, matched to the delivery channel capacity
 */
public record BrokerSubscribeRequest(String topic,
                                     String subscriptionName,
                                     SubscriptionType subscriptionType,
                                     String consumerName,
                                     Duration negativeAckRedeliveryDelay,
                                     int receiverQueueSize) {}

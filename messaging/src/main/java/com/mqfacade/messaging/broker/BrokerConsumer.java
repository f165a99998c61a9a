/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.broker;

/**
 * Broker-side consumer of one subscription.
 */
public interface BrokerConsumer extends AutoCloseable {

    /** Mark the message processed; it will not be redelivered. */
    void acknowledge(InboundMessage message) throws BrokerException;

    /** Ask the broker to redeliver the message after the subscription's negative-ack delay. */
    void negativeAcknowledge(InboundMessage message);

    @Override
    void close();
}

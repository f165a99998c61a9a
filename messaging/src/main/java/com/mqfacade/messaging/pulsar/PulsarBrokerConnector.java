/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.pulsar;

import com.mqfacade.messaging.broker.BrokerClient;
import com.mqfacade.messaging.broker.BrokerConnector;
import com.mqfacade.messaging.broker.BrokerException;
import org.apache.pulsar.client.api.PulsarClient;
import org.apache.pulsar.client.api.PulsarClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Builds a {@link PulsarClient}. Listener threads are sized like the per-broker connection pool so
 * that one subscription blocked on a full delivery channel does not stall the others.
 */
public class PulsarBrokerConnector implements BrokerConnector {

    private static final Logger log = LoggerFactory.getLogger(PulsarBrokerConnector.class);

    @Override
    public BrokerClient connect(String serviceUrl, Duration connectionTimeout, Duration operationTimeout,
                                int maxConnectionsPerBroker) throws BrokerException {
        log.info("Starting Pulsar client for {} (connectionTimeout={}, operationTimeout={}, connectionsPerBroker={})",
                serviceUrl, connectionTimeout, operationTimeout, maxConnectionsPerBroker);
        try {
            PulsarClient client = PulsarClient.builder()
                    .serviceUrl(serviceUrl)
                    .connectionTimeout(clampedMillis(connectionTimeout), TimeUnit.MILLISECONDS)
                    .operationTimeout(clampedMillis(operationTimeout), TimeUnit.MILLISECONDS)
                    .connectionsPerBroker(maxConnectionsPerBroker)
                    .listenerThreads(maxConnectionsPerBroker)
                    .build();
            return new PulsarBrokerClient(client);
        } catch (PulsarClientException e) {
            throw new BrokerException("Cannot create Pulsar client for " + serviceUrl, e);
        }
    }

    /** Pulsar takes int timeouts; anything longer saturates at {@link Integer#MAX_VALUE} ms. */
    static int clampedMillis(Duration timeout) {
        if (timeout.getSeconds() >= Integer.MAX_VALUE / 1000) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE);
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.config;

import com.mqfacade.common.config.MQProperties;
import com.mqfacade.messaging.broker.BrokerConnector;
import com.mqfacade.messaging.client.BrokerMessageClient;
import com.mqfacade.messaging.client.ClientSettings;
import com.mqfacade.messaging.client.ConnectionManager;
import com.mqfacade.messaging.codec.JsonStringCodec;
import com.mqfacade.messaging.core.MessageClient;
import com.mqfacade.messaging.pulsar.PulsarBrokerConnector;

/**
 * Entry point for building a {@link MessageClient}.
 *
 * <pre>{@code
 *   MessageClient client = MessagingFactory.createClient();
 *   client.subscribe(options);
 *   client.send("orders", "{\"id\":1}");
 * }</pre>
 *
 * Construct one client per process and share it; each client owns its own broker connection.
 */
public final class MessagingFactory {

    private MessagingFactory() {}

    /** Pulsar client configured from {@value MQProperties#DEFAULT_RESOURCE} on the classpath. */
    public static MessageClient createClient() {
        return createClient(new PulsarBrokerConnector());
    }

    public static MessageClient createClient(BrokerConnector connector) {
        return createClient(ClientSettings.fromProperties(MQProperties.loadClasspath(MQProperties.DEFAULT_RESOURCE)),
                connector);
    }

    /** Pulsar client configured from {@code pulsar.*} / {@code mqfacade.*} properties. */
    public static MessageClient createClient(MQProperties properties) {
        return createClient(ClientSettings.fromProperties(properties), new PulsarBrokerConnector());
    }

    public static MessageClient createClient(ClientSettings settings) {
        return createClient(settings, new PulsarBrokerConnector());
    }

    public static MessageClient createClient(ClientSettings settings, BrokerConnector connector) {
        return new BrokerMessageClient(new ConnectionManager(connector), settings, new JsonStringCodec());
    }
}

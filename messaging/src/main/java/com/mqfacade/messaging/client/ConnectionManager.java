/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.client;

import com.mqfacade.common.exception.ClientInitializationException;
import com.mqfacade.messaging.broker.BrokerClient;
import com.mqfacade.messaging.broker.BrokerConnector;
import com.mqfacade.messaging.broker.BrokerException;
import com.mqfacade.messaging.consumer.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the one broker connection shared by producers and subscriptions, and the
 * {@link SubscriptionRegistry} those subscriptions report into.
 *
 * <p>{@link #getOrCreateClient} connects at most once: concurrent callers racing the first
 * connection all receive the same handle. Later calls return the existing handle whatever settings
 * they pass. A failed connect leaves the manager empty so that a later call may try again.</p>
 */
public class ConnectionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final BrokerConnector connector;
    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final Object initLock = new Object();
    private volatile ClientHandle handle;

    public ConnectionManager(BrokerConnector connector) {
        this.connector = connector;
    }

    /**
     * @throws ClientInitializationException if the broker connection cannot be established
     */
    public ClientHandle getOrCreateClient(ClientSettings settings) {
        ClientHandle current = handle;
        if (current != null) return current;
        synchronized (initLock) {
            if (handle == null) {
                handle = new ClientHandle(connect(settings), settings.getAppName());
            }
            return handle;
        }
    }

    private BrokerClient connect(ClientSettings settings) {
        log.info("Initializing broker client: {}", settings);
        try {
            BrokerClient client = connector.connect(settings.getServiceUrl(), settings.getConnectionTimeout(),
                    settings.getOperationTimeout(), settings.getMaxConnectionsPerBroker());
            log.info("Broker client initialized for {}", settings.getServiceUrl());
            return client;
        } catch (BrokerException | RuntimeException e) {
            log.error("Broker client initialization failed for {}", settings.getServiceUrl(), e);
            throw new ClientInitializationException(settings.getServiceUrl(), e);
        }
    }

    public SubscriptionRegistry registry() { return registry; }

    public boolean isInitialized() { return handle != null; }

    @Override
    public void close() {
        ClientHandle current = handle;
        if (current != null && !current.isClosed()) {
            log.info("Closing broker client");
            current.close();
        }
    }
}

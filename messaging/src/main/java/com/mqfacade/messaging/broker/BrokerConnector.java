/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.broker;

import java.time.Duration;

/**
 * Opens a connection to the broker. Called at most once per
 * {@link com.mqfacade.messaging.client.ConnectionManager}.
 */
@FunctionalInterface
public interface BrokerConnector {

    BrokerClient connect(String serviceUrl, Duration connectionTimeout, Duration operationTimeout,
                         int maxConnectionsPerBroker) throws BrokerException;
}

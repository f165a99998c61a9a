/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.client;

import com.mqfacade.messaging.broker.BrokerClient;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The single broker connection of a {@link ConnectionManager} together with the application
 * identity used to name consumers.
 */
public final class ClientHandle {

    private final BrokerClient broker;
    private final String appName;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ClientHandle(BrokerClient broker, String appName) {
        this.broker = broker;
        this.appName = appName == null ? "" : appName;
    }

    public BrokerClient broker() { return broker; }

    /**
     * A fresh consumer name, {@code appName-uuid} or a bare uuid without an app name. Every
     * subscription gets its own so that the broker can tell instances apart.
     */
    public String newConsumerName() {
        String id = UUID.randomUUID().toString();
        return appName.isEmpty() ? id : appName + "-" + id;
    }

    public boolean isClosed() { return closed.get(); }

    void close() {
        if (closed.compareAndSet(false, true)) {
            broker.close();
        }
    }
}

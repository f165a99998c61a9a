/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.client;

import com.mqfacade.common.config.MQProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection parameters of the broker client.
 *
 * <p>Recognized property keys:
 * <pre>
 *   pulsar.service-url        broker URL, e.g. pulsar://localhost:6650
 *   pulsar.connectionTimeout  seconds or a duration such as 500ms / 30s / PT1M, default 5s
 *   pulsar.operationTimeout   seconds or a duration, default 30s
 *   mqfacade.app-name         prefix of generated consumer names
 * </pre>
 */
public final class ClientSettings {

    public static final String SERVER_URL_KEY = "pulsar.service-url";
    public static final String CONNECTION_TIMEOUT_KEY = "pulsar.connectionTimeout";
    public static final String OPERATION_TIMEOUT_KEY = "pulsar.operationTimeout";
    public static final String APP_NAME_KEY = "mqfacade.app-name";

    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(30);

    private final String serviceUrl;
    private final Duration connectionTimeout;
    private final Duration operationTimeout;
    private final String appName;
    private final int maxConnectionsPerBroker;

    public ClientSettings(String serviceUrl, Duration connectionTimeout, Duration operationTimeout, String appName) {
        this(serviceUrl, connectionTimeout, operationTimeout, appName, Runtime.getRuntime().availableProcessors());
    }

    public ClientSettings(String serviceUrl, Duration connectionTimeout, Duration operationTimeout, String appName,
                          int maxConnectionsPerBroker) {
        this.serviceUrl = Objects.requireNonNull(serviceUrl, "serviceUrl");
        this.connectionTimeout = positiveOr(connectionTimeout, DEFAULT_CONNECTION_TIMEOUT);
        this.operationTimeout = positiveOr(operationTimeout, DEFAULT_OPERATION_TIMEOUT);
        this.appName = appName == null ? "" : appName;
        this.maxConnectionsPerBroker = Math.max(1, maxConnectionsPerBroker);
    }

    /** Timeouts given in whole seconds; zero or negative selects the default. */
    public static ClientSettings ofSeconds(String serviceUrl, long connectionTimeoutSeconds,
                                           long operationTimeoutSeconds, String appName) {
        return new ClientSettings(serviceUrl, Duration.ofSeconds(connectionTimeoutSeconds),
                Duration.ofSeconds(operationTimeoutSeconds), appName);
    }

    public static ClientSettings fromProperties(MQProperties props) {
        String url = props.getString(SERVER_URL_KEY);
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("Missing required property " + SERVER_URL_KEY);
        }
        return new ClientSettings(url.trim(),
                props.getDuration(CONNECTION_TIMEOUT_KEY, Duration.ZERO),
                props.getDuration(OPERATION_TIMEOUT_KEY, Duration.ZERO),
                props.getString(APP_NAME_KEY, ""));
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }

    public String getServiceUrl() { return serviceUrl; }
    public Duration getConnectionTimeout() { return connectionTimeout; }
    public Duration getOperationTimeout() { return operationTimeout; }
    public String getAppName() { return appName; }
    public int getMaxConnectionsPerBroker() { return maxConnectionsPerBroker; }

    @Override
    public String toString() {
        return "ClientSettings{serviceUrl=" + serviceUrl + ", connectionTimeout=" + connectionTimeout
                + ", operationTimeout=" + operationTimeout + ", appName=" + appName
                + ", maxConnectionsPerBroker=" + maxConnectionsPerBroker + "}";
    }
}

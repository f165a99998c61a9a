/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.common.exception;

/**
 * The broker connection could not be established while building the client.
 */
public class ClientInitializationException extends MQFacadeException {
    public ClientInitializationException(String serviceUrl, Throwable cause) {
        super("MQF_CLIENT_INIT",
              "Failed to connect broker client to '" + serviceUrl + "': " + cause.getMessage(), cause);
    }
}

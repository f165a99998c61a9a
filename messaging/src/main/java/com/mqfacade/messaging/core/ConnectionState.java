/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.core;

/**
 * Lifecycle states of a messaging client.
 */
public enum ConnectionState {
    CONNECTED,
    CLOSING,
    CLOSED
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.core;

/**
 * Broker-level fan-out policy among consumers sharing one subscription.
 */
public enum SubscriptionType {
    EXCLUSIVE,
    SHARED,
    FAILOVER,
    KEY_SHARED
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.consumer;

public enum DispatchOutcome {
    ACKNOWLEDGE,
    NEGATIVE_ACKNOWLEDGE
}

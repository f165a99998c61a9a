/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.core;

/**
 * What happens to a message whose listener failed.
 */
public enum AckMode {
    /** Log the failure and acknowledge; the message is never redelivered. */
    ALWAYS_ACK,
    /** Negatively acknowledge until the redelivery count reaches the retry limit, then acknowledge. */
    ACK_WITH_RETRY
}

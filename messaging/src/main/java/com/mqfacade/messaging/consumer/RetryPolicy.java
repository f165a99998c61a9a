/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.consumer;

import com.mqfacade.messaging.core.AckMode;
import com.mqfacade.messaging.core.ConsumerOptions;

/**
 * Decides what to tell the broker about a message whose listener failed.
 *
 * <ul>
 *   <li>{@link AckMode#ALWAYS_ACK}: acknowledge, the failure is only logged.</li>
 *   <li>{@link AckMode#ACK_WITH_RETRY}: negatively acknowledge while the redelivery count is below
 *       the retry limit, acknowledge once the budget is spent. There is no dead-letter routing.</li>
 * </ul>
 *
 * The retry limit is clamped to {@link ConsumerOptions#MAX_RETRY_TIMES} whatever was configured.
 */
public final class RetryPolicy {

    private RetryPolicy() {}

    public static DispatchOutcome decide(AckMode ackMode, int redeliveryCount, int retryLimit) {
        if (ackMode == AckMode.ACK_WITH_RETRY && redeliveryCount < clamp(retryLimit)) {
            return DispatchOutcome.NEGATIVE_ACKNOWLEDGE;
        }
        return DispatchOutcome.ACKNOWLEDGE;
    }

    public static int clamp(int retryLimit) {
        return Math.min(Math.max(retryLimit, 0), ConsumerOptions.MAX_RETRY_TIMES);
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.core;

/**
 * Callback invoked once per delivered message.
 * Implementations must be thread-safe: deliveries of one subscription are handled concurrently.
 */
@FunctionalInterface
public interface MessageListener {
    /**
     * Handle a delivered message.
     *
     * @param message the decoded message
     * @return {@link ConsumeResult#success()} to acknowledge, or a failure that is routed
     *         through the subscription's retry policy. Throwing is treated like a failure.
     */
    ConsumeResult onMessage(ConsumerMessage message) throws Exception;
}

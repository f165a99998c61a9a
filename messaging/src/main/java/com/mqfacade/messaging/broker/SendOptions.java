/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.broker;

import java.time.Duration;
import java.time.Instant;

/**
 * Delivery timing of an outgoing message. At most one of {@code deliverAfter} / {@code deliverAt} is set.
 */
public record SendOptions(Duration deliverAfter, Instant deliverAt) {

    private static final SendOptions IMMEDIATE = new SendOptions(null, null);

    public SendOptions {
        if (deliverAfter != null && deliverAt != null) {
            throw new IllegalArgumentException("deliverAfter and deliverAt are mutually exclusive");
        }
        if (deliverAfter != null && deliverAfter.isNegative()) {
            throw new IllegalArgumentException("deliverAfter must not be negative: " + deliverAfter);
        }
    }

    public static SendOptions immediate() { return IMMEDIATE; }

    public static SendOptions deliverAfter(Duration delay) {
        return delay == null || delay.isZero() ? IMMEDIATE : new SendOptions(delay, null);
    }

    public static SendOptions deliverAt(Instant at) {
        return new SendOptions(null, at);
    }

    public boolean isDelayed() {
        return deliverAfter != null || deliverAt != null;
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.pulsar;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PulsarBrokerConnectorTest {

    @Test
    void timeoutsConvertToMillis() {
        assertThat(PulsarBrokerConnector.clampedMillis(Duration.ofSeconds(30))).isEqualTo(30_000);
        assertThat(PulsarBrokerConnector.clampedMillis(Duration.ofMillis(1500))).isEqualTo(1500);
    }

    @Test
    void longTimeoutsSaturateInsteadOfOverflowing() {
        assertThat(PulsarBrokerConnector.clampedMillis(Duration.ofSeconds(3_000_000))).isEqualTo(Integer.MAX_VALUE);
        assertThat(PulsarBrokerConnector.clampedMillis(Duration.ofDays(365_000))).isEqualTo(Integer.MAX_VALUE);
    }
}

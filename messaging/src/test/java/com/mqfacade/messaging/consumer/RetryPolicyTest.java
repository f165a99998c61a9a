/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.consumer;

import com.mqfacade.messaging.core.AckMode;
import com.mqfacade.messaging.core.ConsumerOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    @Test
    @DisplayName("retry mode with limit 3: redeliveries 0,1,2 are nacked, 3 is acked")
    void retryBudgetOfThree() {
        assertThat(RetryPolicy.decide(AckMode.ACK_WITH_RETRY, 0, 3)).isEqualTo(DispatchOutcome.NEGATIVE_ACKNOWLEDGE);
        assertThat(RetryPolicy.decide(AckMode.ACK_WITH_RETRY, 1, 3)).isEqualTo(DispatchOutcome.NEGATIVE_ACKNOWLEDGE);
        assertThat(RetryPolicy.decide(AckMode.ACK_WITH_RETRY, 2, 3)).isEqualTo(DispatchOutcome.NEGATIVE_ACKNOWLEDGE);
        assertThat(RetryPolicy.decide(AckMode.ACK_WITH_RETRY, 3, 3)).isEqualTo(DispatchOutcome.ACKNOWLEDGE);
        assertThat(RetryPolicy.decide(AckMode.ACK_WITH_RETRY, 4, 3)).isEqualTo(DispatchOutcome.ACKNOWLEDGE);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 5, 49, 50, 1000})
    void alwaysAckIgnoresRedeliveryCount(int redeliveryCount) {
        assertThat(RetryPolicy.decide(AckMode.ALWAYS_ACK, redeliveryCount, 10)).isEqualTo(DispatchOutcome.ACKNOWLEDGE);
    }

    @Test
    void limitAboveMaximumIsClamped() {
        int max = ConsumerOptions.MAX_RETRY_TIMES;

        assertThat(RetryPolicy.decide(AckMode.ACK_WITH_RETRY, max - 1, 500)).isEqualTo(DispatchOutcome.NEGATIVE_ACKNOWLEDGE);
        assertThat(RetryPolicy.decide(AckMode.ACK_WITH_RETRY, max, 500)).isEqualTo(DispatchOutcome.ACKNOWLEDGE);
        assertThat(RetryPolicy.clamp(500)).isEqualTo(max);
    }

    @Test
    void zeroLimitNeverRetries() {
        assertThat(RetryPolicy.decide(AckMode.ACK_WITH_RETRY, 0, 0)).isEqualTo(DispatchOutcome.ACKNOWLEDGE);
        assertThat(RetryPolicy.clamp(-3)).isZero();
    }
}

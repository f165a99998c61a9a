/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.consumer;

import com.mqfacade.messaging.broker.BrokerConsumer;
import com.mqfacade.messaging.broker.BrokerException;
import com.mqfacade.messaging.broker.InboundMessage;
import com.mqfacade.messaging.codec.Codec;
import com.mqfacade.messaging.codec.JsonStringCodec;
import com.mqfacade.messaging.core.AckMode;
import com.mqfacade.messaging.core.ConsumeResult;
import com.mqfacade.messaging.core.ConsumerMessage;
import com.mqfacade.messaging.core.ConsumerOptions;
import com.mqfacade.messaging.core.MessageListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MessageDispatcherTest {

    private static final String TOPIC = "orders";
    private static final String SUBSCRIPTION = "billing";

    @Mock
    private BrokerConsumer consumer;

    private SubscriptionRegistry registry;
    private final JsonStringCodec codec = new JsonStringCodec();

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry();
    }

    private static ConsumerOptions options(AckMode ackMode, int retryTimes, MessageListener listener) {
        return ConsumerOptions.builder()
                .topic(TOPIC)
                .subscriptionName(SUBSCRIPTION)
                .ackMode(ackMode)
                .retryTimes(retryTimes)
                .messageListener(listener)
                .build()
                .normalized();
    }

    private static InboundMessage message(String json, int redeliveryCount) {
        return new InboundMessage(TOPIC, SUBSCRIPTION, "id-" + redeliveryCount,
                json.getBytes(StandardCharsets.UTF_8), redeliveryCount, Instant.EPOCH, "producer-1");
    }

    private void dispatch(ConsumerOptions options, InboundMessage message) {
        new MessageDispatcher(message, consumer, codec, options, registry).run();
    }

    @Test
    void successIsAcknowledgedWithDecodedValue() throws Exception {
        ArgumentCaptor<ConsumerMessage> captor = ArgumentCaptor.forClass(ConsumerMessage.class);
        MessageListener listener = mock(MessageListener.class);
        when(listener.onMessage(captor.capture())).thenReturn(ConsumeResult.success());
        ConsumerOptions options = options(AckMode.ACK_WITH_RETRY, 3, listener);
        registry.store(options);

        InboundMessage message = message("\"hello\"", 2);
        dispatch(options, message);

        verify(consumer).acknowledge(message);
        verify(consumer, never()).negativeAcknowledge(any());
        assertThat(captor.getValue().getValue()).isEqualTo("hello");
        assertThat(captor.getValue().getRedeliveryCount()).isEqualTo(2);
        assertThat(captor.getValue().getSubscriptionName()).isEqualTo(SUBSCRIPTION);
    }

    @Test
    @DisplayName("retry mode, limit 3, always failing: 0,1,2 nacked, 3 acked")
    void failingListenerWithRetryBudget() throws Exception {
        ConsumerOptions options = options(AckMode.ACK_WITH_RETRY, 3, msg -> ConsumeResult.failure("boom"));
        registry.store(options);

        for (int count = 0; count < 3; count++) {
            InboundMessage message = message("\"v\"", count);
            dispatch(options, message);
            verify(consumer).negativeAcknowledge(message);
            verify(consumer, never()).acknowledge(message);
        }
        InboundMessage last = message("\"v\"", 3);
        dispatch(options, last);
        verify(consumer).acknowledge(last);
        verify(consumer, never()).negativeAcknowledge(last);
    }

    @Test
    @DisplayName("codec crash counts as a failure: nack at redelivery 0, ack at 3, listener never called")
    void crashingCodecIsContained() throws Exception {
        Codec crashing = mock(Codec.class);
        when(crashing.decode(any())).thenThrow(new IllegalStateException("decoder bug"));
        MessageListener listener = mock(MessageListener.class);
        ConsumerOptions options = options(AckMode.ACK_WITH_RETRY, 3, listener);
        registry.store(options);

        InboundMessage first = message("\"v\"", 0);
        InboundMessage last = message("\"v\"", 3);
        new MessageDispatcher(first, consumer, crashing, options, registry).run();
        new MessageDispatcher(last, consumer, crashing, options, registry).run();

        verify(consumer, times(1)).negativeAcknowledge(first);
        verify(consumer, never()).acknowledge(first);
        verify(consumer, times(1)).acknowledge(last);
        verify(consumer, never()).negativeAcknowledge(last);
        verifyNoInteractions(listener);
    }

    @Test
    void alwaysAckNeverNacks() throws Exception {
        ConsumerOptions options = options(AckMode.ALWAYS_ACK, 10, msg -> ConsumeResult.failure("nope"));
        registry.store(options);

        for (int count = 0; count < 5; count++) {
            dispatch(options, message("\"v\"", count));
        }

        verify(consumer, times(5)).acknowledge(any());
        verify(consumer, never()).negativeAcknowledge(any());
    }

    @Test
    void thrownExceptionIsTreatedAsFailure() throws Exception {
        ConsumerOptions options = options(AckMode.ACK_WITH_RETRY, 3, msg -> {
            throw new IllegalStateException("listener bug");
        });
        registry.store(options);

        InboundMessage message = message("\"v\"", 0);
        dispatch(options, message);

        verify(consumer).negativeAcknowledge(message);
        verify(consumer, never()).acknowledge(any());
    }

    @Test
    void errorThrownByListenerIsContained() throws Exception {
        ConsumerOptions options = options(AckMode.ACK_WITH_RETRY, 3, msg -> {
            throw new AssertionError("unexpected fault");
        });
        registry.store(options);

        InboundMessage message = message("\"v\"", 3);
        dispatch(options, message);

        verify(consumer).acknowledge(message);
    }

    @Test
    void nullResultIsTreatedAsFailure() {
        ConsumerOptions options = options(AckMode.ACK_WITH_RETRY, 3, msg -> null);
        registry.store(options);

        InboundMessage message = message("\"v\"", 1);
        dispatch(options, message);

        verify(consumer).negativeAcknowledge(message);
    }

    @Test
    void missingRegistryEntryAcknowledges() throws Exception {
        ConsumerOptions options = options(AckMode.ACK_WITH_RETRY, 3, msg -> ConsumeResult.failure("boom"));

        InboundMessage message = message("\"v\"", 0);
        dispatch(options, message);

        verify(consumer).acknowledge(message);
        verify(consumer, never()).negativeAcknowledge(any());
    }

    @Test
    void retryDecisionUsesLatestRegisteredOptions() throws Exception {
        ConsumerOptions started = options(AckMode.ACK_WITH_RETRY, 5, msg -> ConsumeResult.failure("boom"));
        registry.store(started);
        registry.store(started.toBuilder().retryTimes(1).build().normalized());

        InboundMessage message = message("\"v\"", 2);
        dispatch(started, message);

        verify(consumer).acknowledge(message);
        verify(consumer, never()).negativeAcknowledge(any());
    }

    @Test
    void undecodablePayloadReachesListenerAsEmptyValue() throws Exception {
        ArgumentCaptor<ConsumerMessage> captor = ArgumentCaptor.forClass(ConsumerMessage.class);
        MessageListener listener = mock(MessageListener.class);
        when(listener.onMessage(captor.capture())).thenReturn(ConsumeResult.success());
        ConsumerOptions options = options(AckMode.ALWAYS_ACK, 0, listener);
        registry.store(options);

        InboundMessage message = message("{not json", 0);
        dispatch(options, message);

        assertThat(captor.getValue().getValue()).isEmpty();
        assertThat(new String(captor.getValue().getPayload(), StandardCharsets.UTF_8)).isEqualTo("{not json");
        verify(consumer).acknowledge(message);
    }

    @Test
    void acknowledgeFailureDoesNotEscape() throws Exception {
        ConsumerOptions options = options(AckMode.ALWAYS_ACK, 0, msg -> ConsumeResult.success());
        registry.store(options);
        InboundMessage message = message("\"v\"", 0);
        doThrow(new BrokerException("connection lost")).when(consumer).acknowledge(message);

        dispatch(options, message);

        verify(consumer).acknowledge(message);
        verify(consumer, never()).negativeAcknowledge(any());
    }
}

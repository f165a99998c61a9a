/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.consumer;

import com.mqfacade.messaging.core.ConsumerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Active subscription options keyed by {@code topic:subscriptionName}.
 *
 * <p>Written once per subscribe call and read by every dispatch. A second subscribe with the same
 * key replaces the stored options (last write wins, no merge); entries live as long as the
 * registry.</p>
 */
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final Map<String, ConsumerOptions> options = new ConcurrentHashMap<>();

    public void store(ConsumerOptions consumerOptions) {
        ConsumerOptions previous = options.put(consumerOptions.key(), consumerOptions);
        if (previous != null) {
            log.info("Replaced consumer options for {}: {}", consumerOptions.key(), consumerOptions);
        } else {
            log.info("Stored consumer options for {}: {}", consumerOptions.key(), consumerOptions);
        }
    }

    public Optional<ConsumerOptions> lookup(String topic, String subscriptionName) {
        return Optional.ofNullable(options.get(ConsumerOptions.key(topic, subscriptionName)));
    }

    public int size() { return options.size(); }
}

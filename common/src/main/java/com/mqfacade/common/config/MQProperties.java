/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.common.config;

import com.mqfacade.common.util.ConfigPropertyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Typed property accessor for the messaging client.
 *
 * <p>Instances are created explicitly and handed to whoever builds the client; there is no
 * process-wide instance. Values loaded from a properties file have their {@code ${...}}
 * placeholders resolved by {@link ConfigPropertyResolver} before they are stored.</p>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 *   MQProperties props = MQProperties.loadClasspath("mqfacade.properties");
 *   String url = props.getString("pulsar.service-url", "pulsar://localhost:6650");
 *   Duration timeout = props.getDuration("pulsar.connectionTimeout", Duration.ofSeconds(5));
 * }</pre>
 *
 * <h3>Thread Safety</h3>
 * <p>Backed by a {@link ConcurrentHashMap}; reads are safe from any thread.</p>
 */
public final class MQProperties {

    private static final Logger log = LoggerFactory.getLogger(MQProperties.class);

    public static final String DEFAULT_RESOURCE = "mqfacade.properties";

    private final Map<String, String> properties;

    public MQProperties(Map<String, String> properties) {
        this.properties = new ConcurrentHashMap<>(properties);
    }

    // ─── Loading ────────────────────────────────────────────────────

    /**
     * Build from a {@link Properties} object, resolving placeholders.
     */
    public static MQProperties fromProperties(Properties source) {
        return new MQProperties(new ConfigPropertyResolver(source).resolveAll());
    }

    /**
     * Load a classpath resource. A missing resource yields an empty instance so that
     * callers fall back to their defaults.
     */
    public static MQProperties loadClasspath(String resource) {
        Properties source = new Properties();
        try (InputStream is = MQProperties.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                log.warn("Properties resource {} not found on classpath, using defaults", resource);
                return new MQProperties(Map.of());
            }
            source.load(is);
            log.info("Loaded {} properties from classpath:{}", source.size(), resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read classpath properties " + resource, e);
        }
        return fromProperties(source);
    }

    // ─── Core Typed Getters ─────────────────────────────────────────

    /**
     * Raw property value, or {@code null} if absent.
     */
    public String getString(String key) {
        return properties.get(key);
    }

    public String getString(String key, String defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }

    /**
     * Parse a duration string. Supports:
     * <ul>
     *   <li>Plain number → seconds</li>
     *   <li>{@code "500ms"}, {@code "30s"}, {@code "5m"}, {@code "2h"}</li>
     *   <li>ISO-8601 ({@code "PT30S"}) via {@link Duration#parse}</li>
     * </ul>
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        val = val.trim().toLowerCase();
        try {
            if (val.startsWith("pt")) return Duration.parse(val.toUpperCase());
            if (val.endsWith("ms")) return Duration.ofMillis(Long.parseLong(val.replace("ms", "").trim()));
            if (val.endsWith("s"))  return Duration.ofSeconds(Long.parseLong(val.replace("s", "").trim()));
            if (val.endsWith("m"))  return Duration.ofMinutes(Long.parseLong(val.replace("m", "").trim()));
            if (val.endsWith("h"))  return Duration.ofHours(Long.parseLong(val.replace("h", "").trim()));
            return Duration.ofSeconds(Long.parseLong(val));
        } catch (RuntimeException e) {
            log.warn("Property {}='{}' is not a duration, using {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "MQProperties{count=" + properties.size() + "}";
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.common.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${key}} and {@code ${key:defaultValue}} placeholders in client configuration
 * values using a waterfall resolution strategy:
 *
 * <ol>
 *   <li><strong>JVM system properties</strong> ({@code -Dkey=value})</li>
 *   <li><strong>the loaded properties file</strong> ({@code mqfacade.properties})</li>
 *   <li><strong>Environment variables</strong></li>
 *   <li><strong>Default value</strong> specified after colon: {@code ${key:defaultValue}}</li>
 *   <li>If none resolve → throws {@link ConfigResolutionException}</li>
 * </ol>
 *
 * <p><strong>Escaping colons:</strong> Use {@code \:} to include a literal colon in a default.
 * Example: {@code ${pulsar.service-url:pulsar\://localhost\:6650}} resolves the default to
 * {@code pulsar://localhost:6650}.</p>
 */
public class ConfigPropertyResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigPropertyResolver.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    private final Properties source;

    public ConfigPropertyResolver(Properties source) {
        this.source = source != null ? source : new Properties();
    }

    /**
     * Resolve a single string value, replacing all ${...} placeholders.
     *
     * @throws ConfigResolutionException if a placeholder cannot be resolved
     */
    public String resolve(String value) {
        if (value == null || !value.contains("${")) return value;

        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String resolved = resolveExpression(matcher.group(1));
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Resolve every value of the source properties. Keys keep their file order where
     * the underlying {@link Properties} preserves it.
     */
    public Map<String, String> resolveAll() {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (String key : source.stringPropertyNames()) {
            resolved.put(key, resolve(source.getProperty(key)));
        }
        return resolved;
    }

    private String resolveExpression(String expr) {
        String key;
        String defaultValue = null;

        int colonIdx = findUnescapedColon(expr);
        if (colonIdx >= 0) {
            key = expr.substring(0, colonIdx).trim();
            defaultValue = unescape(expr.substring(colonIdx + 1));
        } else {
            key = expr.trim();
        }

        String val = System.getProperty(key);
        if (val != null) {
            log.debug("Resolved ${{{}}} from JVM system property", key);
            return val;
        }

        val = source.getProperty(key);
        if (val != null && !val.contains("${" + key)) {
            log.debug("Resolved ${{{}}} from properties file", key);
            return val;
        }

        val = System.getenv(key);
        if (val != null) {
            log.debug("Resolved ${{{}}} from environment variable", key);
            return val;
        }

        if (defaultValue != null) {
            log.debug("Resolved ${{{}}} using default: {}", key, defaultValue);
            return defaultValue;
        }

        String msg = "Cannot resolve configuration placeholder ${" + key + "}. " +
                "Provide it as a JVM arg -D" + key + "=value, a properties entry, " +
                "an environment variable, or an inline default ${" + key + ":defaultValue}";
        log.error(msg);
        throw new ConfigResolutionException(msg);
    }

    private int findUnescapedColon(String expr) {
        for (int i = 0; i < expr.length(); i++) {
            if (expr.charAt(i) == ':' && (i == 0 || expr.charAt(i - 1) != '\\')) {
                return i;
            }
        }
        return -1;
    }

    private String unescape(String value) {
        return value.replace("\\:", ":");
    }

    /**
     * Thrown when a placeholder cannot be resolved through the waterfall.
     */
    public static class ConfigResolutionException extends RuntimeException {
        public ConfigResolutionException(String message) {
            super(message);
        }
    }
}

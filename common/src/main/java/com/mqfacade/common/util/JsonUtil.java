/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Locale;

/**
 * Centralized Jackson ObjectMapper utility, shared and thread-safe.
 * Output is compact since it ends up in message payloads.
 */
public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonUtil() {}

    public static byte[] toBytes(Object obj) throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(obj);
    }

    /**
     * Read a document holding a single JSON string literal.
     *
     * @return the string, or {@code null} for the literal {@code null}
     * @throws IOException if the document is empty, malformed or holds any other JSON type
     */
    public static String readString(byte[] json) throws IOException {
        JsonNode node = MAPPER.readTree(json);
        if (node == null || node.isMissingNode()) {
            throw new IOException("Empty JSON document");
        }
        if (node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new IOException("Expected a JSON string but found "
                    + node.getNodeType().name().toLowerCase(Locale.ROOT));
        }
        return node.textValue();
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.codec;

import com.mqfacade.common.util.JsonUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Stores each value as a JSON string literal, so {@code hello} travels as {@code "hello"}.
 * This is the broker-side JSON schema of type {@code "string"}, which keeps payloads readable
 * by consumers that decode with a schema-aware client.
 */
public class JsonStringCodec implements Codec {

    @Override
    public byte[] encode(String value) throws CodecException {
        try {
            return JsonUtil.toBytes(value);
        } catch (IOException e) {
            throw new CodecException("Cannot encode value as JSON string", e);
        }
    }

    @Override
    public String decode(byte[] payload) throws CodecException {
        if (payload == null || payload.length == 0) {
            throw new CodecException("Empty payload", null);
        }
        String value;
        try {
            value = JsonUtil.readString(payload);
        } catch (IOException e) {
            throw new CodecException("Payload is not a JSON string (" + e.getMessage() + "): "
                    + abbreviate(payload), e);
        }
        return value == null ? "" : value;
    }

    private static String abbreviate(byte[] payload) {
        String s = new String(payload, StandardCharsets.UTF_8);
        return s.length() <= 64 ? s : s.substring(0, 64) + "...";
    }
}

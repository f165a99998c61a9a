/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.codec;

/**
 * Converts between message values and the bytes stored on the broker.
 * Implementations must be thread-safe.
 */
public interface Codec {

    byte[] encode(String value) throws CodecException;

    String decode(byte[] payload) throws CodecException;
}

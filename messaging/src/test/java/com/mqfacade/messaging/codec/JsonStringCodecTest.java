/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.messaging.codec;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonStringCodecTest {

    private final JsonStringCodec codec = new JsonStringCodec();

    @Test
    void encodesAsJsonStringLiteral() throws Exception {
        assertThat(new String(codec.encode("line\nbreak"), StandardCharsets.UTF_8))
                .isEqualTo("\"line\\nbreak\"");
    }

    @Test
    void decodesJsonStringLiteral() throws Exception {
        assertThat(codec.decode("\"caf\\u00e9\"".getBytes(StandardCharsets.UTF_8))).isEqualTo("café");
    }

    @Test
    void rejectsEmptyPayload() {
        assertThatThrownBy(() -> codec.decode(new byte[0]))
                .isInstanceOf(CodecException.class)
                .hasMessage("Empty payload");
    }

    @Test
    void rejectsObjectPayload() {
        assertThatThrownBy(() -> codec.decode("{\"id\":1}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("{\"id\":1}");
    }

    @Test
    void jsonNullDecodesToEmptyValue() throws Exception {
        assertThat(codec.decode("null".getBytes(StandardCharsets.UTF_8))).isEmpty();
        assertThat(codec.decode(codec.encode(null))).isEmpty();
    }

    @Test
    void rejectsNonStringScalars() {
        assertThatThrownBy(() -> codec.decode("123".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("number");
        assertThatThrownBy(() -> codec.decode("true".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("boolean");
    }

    @Test
    void rejectsWhitespaceOnlyPayload() {
        assertThatThrownBy(() -> codec.decode("   ".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CodecException.class);
    }
}

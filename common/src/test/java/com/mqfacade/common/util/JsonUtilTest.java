/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.mqfacade.common.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonUtilTest {

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void writesStringsAsCompactLiterals() throws Exception {
        assertThat(new String(JsonUtil.toBytes("a \"b\""), StandardCharsets.UTF_8)).isEqualTo("\"a \\\"b\\\"\"");
    }

    @Test
    void readsStringLiteralsAndNull() throws Exception {
        assertThat(JsonUtil.readString(utf8(" \"hello\" "))).isEqualTo("hello");
        assertThat(JsonUtil.readString(utf8("null"))).isNull();
    }

    @Test
    void rejectsOtherJsonTypes() {
        assertThatThrownBy(() -> JsonUtil.readString(utf8("123")))
                .isInstanceOf(IOException.class)
                .hasMessage("Expected a JSON string but found number");
        assertThatThrownBy(() -> JsonUtil.readString(utf8("[\"a\"]")))
                .isInstanceOf(IOException.class)
                .hasMessage("Expected a JSON string but found array");
        assertThatThrownBy(() -> JsonUtil.readString(utf8("  ")))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> JsonUtil.readString(utf8("{broken")))
                .isInstanceOf(IOException.class);
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.model;

import com.subingest.common.util.JsonUtil;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EventTest {

    private final Event event = new Event("abc-1", Instant.parse("2025-03-01T10:00:00Z"),
            Map.of("event", Map.of("id", "abc-1"), "message", "hello"), new Object());

    @Test
    void resolvesDottedPaths() {
        assertThat(event.getField("event.id")).isEqualTo("abc-1");
        assertThat(event.getField("message")).isEqualTo("hello");
        assertThat(event.getField("event.created")).isNull();
        assertThat(event.getField("message.length")).isNull();
        assertThat(event.hasField("labels")).isFalse();
    }

    @Test
    void privateReferenceIsNotSerialized() {
        String json = JsonUtil.toCompactJson(event);

        assertThat(json).contains("\"id\":\"abc-1\"").doesNotContain("privateRef");
    }
}

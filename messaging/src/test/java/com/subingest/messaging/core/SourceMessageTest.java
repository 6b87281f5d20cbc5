/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SourceMessageTest {

    private final AckReply reply = mock(AckReply.class);

    private SourceMessage message(Map<String, String> attributes) {
        return new SourceMessage("42", "hello".getBytes(StandardCharsets.UTF_8), attributes,
                Instant.parse("2025-01-01T00:00:00Z"), 1, reply);
    }

    @Test
    void firstSettlementWins() {
        SourceMessage message = message(null);

        assertThat(message.ack()).isTrue();
        assertThat(message.nack()).isFalse();
        assertThat(message.ack()).isFalse();

        assertThat(message.getOutcome()).isEqualTo(SourceMessage.Outcome.ACKED);
        verify(reply, times(1)).reply(true);
        verify(reply, never()).reply(false);
    }

    @Test
    void nackIsForwardedOnce() {
        SourceMessage message = message(null);

        assertThat(message.isSettled()).isFalse();
        assertThat(message.nack()).isTrue();
        assertThat(message.isSettled()).isTrue();
        verify(reply, times(1)).reply(false);
    }

    @Test
    void payloadCannotBeModifiedThroughGetter() {
        SourceMessage message = message(null);

        message.getData()[0] = 'X';

        assertThat(new String(message.getData(), StandardCharsets.UTF_8)).isEqualTo("hello");
        assertThat(message.getSize()).isEqualTo(5);
    }

    @Test
    void attributesAreCopiedAndReadOnly() {
        Map<String, String> attrs = new HashMap<>();
        attrs.put("origin", "eu");
        SourceMessage message = message(attrs);
        attrs.put("late", "x");

        assertThat(message.getAttributes()).containsOnlyKeys("origin");
        assertThatThrownBy(() -> message.getAttributes().put("k", "v"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(message(null).getAttributes()).isEmpty();
    }
}

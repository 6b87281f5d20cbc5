/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input.pubsub;

import com.subingest.messaging.core.AckReply;
import com.subingest.messaging.core.SourceMessage;
import com.subingest.server.metrics.InputMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class AckBridgeTest {

    private static final Instant PUBLISHED = Instant.parse("2025-06-01T12:00:00Z");

    private final InputMetrics metrics = new InputMetrics("orders", new SimpleMeterRegistry());
    private final AckBridge bridge = new AckBridge("[orders]", metrics,
            Clock.fixed(PUBLISHED.plusMillis(250), ZoneOffset.UTC));
    private final AckReply reply = mock(AckReply.class);

    private SourceMessage message() {
        return new SourceMessage("1", new byte[]{1, 2, 3, 4}, null, PUBLISHED, 1, reply);
    }

    @Test
    void successAcksAndRecordsMetrics() {
        SourceMessage message = message();

        bridge.onOutcome(message, true);

        verify(reply).reply(true);
        assertThat(message.getOutcome()).isEqualTo(SourceMessage.Outcome.ACKED);
        assertThat(metrics.getAckedCount()).isEqualTo(1);
        assertThat(metrics.getBytesProcessed()).isEqualTo(4);
        assertThat(metrics.getProcessingTimeCount()).isEqualTo(1);
        assertThat(metrics.getProcessingTimeMaxMs()).isEqualTo(250.0);
    }

    @Test
    void failureNeverNacks() {
        SourceMessage message = message();

        bridge.onOutcome(message, false);

        verify(reply, never()).reply(anyBoolean());
        assertThat(message.isSettled()).isFalse();
        assertThat(metrics.getFailedAckedCount()).isEqualTo(1);
        assertThat(metrics.getAckedCount()).isZero();
    }

    @Test
    void unknownReferenceCountsAsFailedAck() {
        bridge.onOutcome("not a message", true);
        bridge.onOutcome(null, true);

        assertThat(metrics.getFailedAckedCount()).isEqualTo(2);
        assertThat(metrics.getAckedCount()).isZero();
    }

    @Test
    void alreadySettledMessageIsNotCountedTwice() {
        SourceMessage message = message();
        message.nack();

        bridge.onOutcome(message, true);

        assertThat(message.getOutcome()).isEqualTo(SourceMessage.Outcome.NACKED);
        assertThat(metrics.getAckedCount()).isZero();
        assertThat(metrics.getFailedAckedCount()).isZero();
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input.pubsub;

import com.subingest.messaging.core.SourceMessage;
import com.subingest.server.metrics.InputMetrics;
import com.subingest.server.pipeline.AckListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Settles source messages once the pipeline reports what happened to their
 * events. A successful outcome acks the message; anything else is counted
 * and logged and the message is left for the source to redeliver. This path
 * never nacks.
 */
public class AckBridge implements AckListener {

    private static final Logger log = LoggerFactory.getLogger(AckBridge.class);

    private final String logPrefix;
    private final InputMetrics metrics;
    private final Clock clock;

    public AckBridge(String logPrefix, InputMetrics metrics) {
        this(logPrefix, metrics, Clock.systemUTC());
    }

    public AckBridge(String logPrefix, InputMetrics metrics, Clock clock) {
        this.logPrefix = logPrefix;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public void onOutcome(Object privateRef, boolean success) {
        if (success && privateRef instanceof SourceMessage message) {
            if (!message.ack()) {
                log.debug("{} Message {} was already settled ({})", logPrefix, message.getId(), message.getOutcome());
                return;
            }
            Duration latency = message.getPublishTime() != null
                    ? Duration.between(message.getPublishTime(), clock.instant())
                    : null;
            metrics.recordAcked(message.getSize(), latency);
            return;
        }
        metrics.recordFailedAck();
        log.error("{} Failed ACKing pub/sub event{}", logPrefix,
                privateRef instanceof SourceMessage m ? " for message " + m.getId() : "");
    }
}

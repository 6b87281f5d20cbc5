/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input.pubsub;

import com.subingest.common.concurrent.CancellationScope;
import com.subingest.common.exception.MessageSourceException;
import com.subingest.common.model.Event;
import com.subingest.common.model.WorkerState;
import com.subingest.messaging.core.ReceiveSettings;
import com.subingest.messaging.core.SourceMessage;
import com.subingest.messaging.core.Subscription;
import com.subingest.server.metrics.InputMetrics;
import com.subingest.server.pipeline.EventSink;
import com.subingest.server.status.StatusReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;

/**
 * Receive loop of one attempt.
 *
 * <p>Every inbound message is mapped to an event and delivered to the sink.
 * When the sink rejects an event the message is nacked and the attempt scope
 * is cancelled, which ends this receive; the watchdog starts the next attempt
 * once its restart interval allows. Messages that arrive after the attempt
 * was cancelled are nacked without being delivered.</p>
 */
public class MessagePump {

    private static final Logger log = LoggerFactory.getLogger(MessagePump.class);

    private final String logPrefix;
    private final String projectId;
    private final String topic;
    private final EventMapper mapper;
    private final EventSink sink;
    private final InputMetrics metrics;
    private final StatusReporter status;

    public MessagePump(String logPrefix, String projectId, String topic, EventMapper mapper,
                       EventSink sink, InputMetrics metrics, StatusReporter status) {
        this.logPrefix = logPrefix;
        this.projectId = projectId;
        this.topic = topic;
        this.mapper = mapper;
        this.sink = sink;
        this.metrics = metrics;
        this.status = status;
    }

    /**
     * Apply the flow-control settings and receive until {@code attempt} is
     * cancelled.
     *
     * @throws MessageSourceException if the subscription reports a receive error;
     *                                the status is set to Degraded first
     * @throws CancellationException  unwrapped, if the receive ended because a scope was cancelled
     */
    public void receive(CancellationScope attempt, Subscription subscription, ReceiveSettings settings) {
        subscription.setReceiveSettings(settings);
        try {
            subscription.receive(attempt, message -> onMessage(attempt, message));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            String detail = String.format("failed to receive message from pub/sub topic %s/%s: %s",
                    projectId, topic, e.getMessage());
            status.updateStatus(WorkerState.DEGRADED, detail);
            throw e instanceof MessageSourceException ? e : new MessageSourceException(detail, e);
        }
    }

    void onMessage(CancellationScope attempt, SourceMessage message) {
        if (attempt.isCancelled()) {
            message.nack();
            log.debug("{} Attempt already cancelled ({}), returned message {} to the source",
                    logPrefix, attempt.getReason(), message.getId());
            return;
        }
        Event event = mapper.toEvent(message);
        if (!sink.deliver(event)) {
            message.nack();
            metrics.recordNacked();
            log.debug("{} Pipeline rejected event {}. Stopping input worker.", logPrefix, event.getId());
            attempt.cancel("pipeline rejected event " + event.getId());
        }
    }
}

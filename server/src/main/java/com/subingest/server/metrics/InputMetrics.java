/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-input Micrometer meters, all tagged with {@code input_id}.
 *
 * <h3>Metric Catalogue</h3>
 * <table>
 *   <tr><th>Metric</th><th>Type</th></tr>
 *   <tr><td>subingest.pubsub.acked_message_count</td><td>Counter</td></tr>
 *   <tr><td>subingest.pubsub.failed_acked_message_count</td><td>Counter</td></tr>
 *   <tr><td>subingest.pubsub.nacked_message_count</td><td>Counter</td></tr>
 *   <tr><td>subingest.pubsub.bytes_processed_total</td><td>Counter</td></tr>
 *   <tr><td>subingest.pubsub.processing_time</td><td>Timer (publish to ack)</td></tr>
 * </table>
 *
 * <p>{@link #close()} removes the meters from the registry so a restarted
 * input with the same id starts from zero.</p>
 */
public class InputMetrics implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InputMetrics.class);

    public static final String ACKED = "subingest.pubsub.acked_message_count";
    public static final String FAILED_ACKED = "subingest.pubsub.failed_acked_message_count";
    public static final String NACKED = "subingest.pubsub.nacked_message_count";
    public static final String BYTES_PROCESSED = "subingest.pubsub.bytes_processed_total";
    public static final String PROCESSING_TIME = "subingest.pubsub.processing_time";

    private final String inputId;
    private final MeterRegistry registry;
    private final Counter acked;
    private final Counter failedAcked;
    private final Counter nacked;
    private final Counter bytesProcessed;
    private final Timer processingTime;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public InputMetrics(String inputId, MeterRegistry registry) {
        this.inputId = inputId;
        this.registry = registry != null ? registry : new SimpleMeterRegistry();
        Tags tags = Tags.of("input_id", inputId);

        this.acked = Counter.builder(ACKED)
                .description("Messages acknowledged after successful downstream delivery")
                .tags(tags).register(this.registry);
        this.failedAcked = Counter.builder(FAILED_ACKED)
                .description("Messages left unacknowledged because downstream delivery failed")
                .tags(tags).register(this.registry);
        this.nacked = Counter.builder(NACKED)
                .description("Messages negatively acknowledged because the pipeline rejected them")
                .tags(tags).register(this.registry);
        this.bytesProcessed = Counter.builder(BYTES_PROCESSED)
                .description("Payload bytes of acknowledged messages")
                .baseUnit("bytes")
                .tags(tags).register(this.registry);
        this.processingTime = Timer.builder(PROCESSING_TIME)
                .description("Time from publish to acknowledgment")
                .tags(tags).register(this.registry);
    }

    public void recordAcked(long payloadBytes, Duration latency) {
        acked.increment();
        bytesProcessed.increment(payloadBytes);
        if (latency != null && !latency.isNegative()) {
            processingTime.record(latency);
        }
    }

    public void recordFailedAck() { failedAcked.increment(); }

    public void recordNacked() { nacked.increment(); }

    public long getAckedCount() { return (long) acked.count(); }
    public long getFailedAckedCount() { return (long) failedAcked.count(); }
    public long getNackedCount() { return (long) nacked.count(); }
    public long getBytesProcessed() { return (long) bytesProcessed.count(); }
    public long getProcessingTimeCount() { return processingTime.count(); }
    public double getProcessingTimeMaxMs() { return processingTime.max(TimeUnit.MILLISECONDS); }
    public String getInputId() { return inputId; }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        for (Meter meter : List.of(acked, failedAcked, nacked, bytesProcessed, processingTime)) {
            registry.remove(meter);
        }
        log.debug("[{}] Metrics unregistered", inputId);
    }

    public boolean isClosed() { return closed.get(); }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.pipeline;

import com.subingest.common.model.Event;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class BufferedEventPipelineTest {

    private final List<Event> published = new CopyOnWriteArrayList<>();
    private BufferedEventPipeline pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null) pipeline.close();
    }

    private static Event event(String id, Object ref) {
        return new Event(id, Instant.now(), Map.of("message", id), ref);
    }

    @Test
    void connectRequiresRunningPipeline() {
        pipeline = new BufferedEventPipeline(4, 1, published::add);

        assertThatThrownBy(() -> pipeline.connect("orders", mock(AckListener.class)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void publishesAndReportsSuccess() {
        pipeline = new BufferedEventPipeline(4, 1, published::add);
        pipeline.start();
        AckListener listener = mock(AckListener.class);
        Object ref = new Object();

        EventSink sink = pipeline.connect("orders", listener);

        assertThat(sink.deliver(event("e1", ref))).isTrue();
        verify(listener, timeout(5000)).onOutcome(ref, true);
        assertThat(published).extracting(Event::getId).containsExactly("e1");
        assertThat(pipeline.getAcceptedCount()).isEqualTo(1);
        assertThat(pipeline.getPublishedCount()).isEqualTo(1);
    }

    @Test
    void publisherFailureIsReportedAsFailedOutcome() {
        pipeline = new BufferedEventPipeline(4, 1, e -> { throw new IllegalStateException("downstream"); });
        pipeline.start();
        AckListener listener = mock(AckListener.class);
        Object ref = new Object();

        pipeline.connect("orders", listener).deliver(event("e1", ref));

        verify(listener, timeout(5000)).onOutcome(ref, false);
        assertThat(pipeline.getFailedCount()).isEqualTo(1);
    }

    @Test
    void fullQueueRejects() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch publishing = new CountDownLatch(1);
        pipeline = new BufferedEventPipeline(1, 1, e -> {
            publishing.countDown();
            release.await(5, TimeUnit.SECONDS);
        });
        pipeline.start();
        EventSink sink = pipeline.connect("orders", mock(AckListener.class));

        assertThat(sink.deliver(event("e1", null))).isTrue();
        assertThat(publishing.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(sink.deliver(event("e2", null))).isTrue();
        assertThat(sink.deliver(event("e3", null))).isFalse();
        assertThat(pipeline.getRejectedCount()).isEqualTo(1);
        release.countDown();
    }

    @Test
    void pausedPipelineRejectsUntilResumed() {
        pipeline = new BufferedEventPipeline(4, 1, published::add);
        pipeline.start();
        EventSink sink = pipeline.connect("orders", mock(AckListener.class));

        pipeline.pause();
        assertThat(pipeline.isPaused()).isTrue();
        assertThat(sink.deliver(event("e1", null))).isFalse();

        pipeline.resume();
        assertThat(sink.deliver(event("e2", null))).isTrue();
    }

    @Test
    void closedConnectionRejects() {
        pipeline = new BufferedEventPipeline(4, 1, published::add);
        pipeline.start();
        EventSink sink = pipeline.connect("orders", mock(AckListener.class));
        assertThat(pipeline.getConnectionCount()).isEqualTo(1);

        sink.close();
        sink.close();

        assertThat(pipeline.getConnectionCount()).isZero();
        assertThat(sink.deliver(event("e1", null))).isFalse();
    }

    @Test
    void closeReportsQueuedEventsAsFailed() throws InterruptedException {
        CountDownLatch publishing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        pipeline = new BufferedEventPipeline(4, 1, e -> {
            publishing.countDown();
            release.await(5, TimeUnit.SECONDS);
        });
        pipeline.start();
        AckListener listener = mock(AckListener.class);
        Object queuedRef = new Object();
        EventSink sink = pipeline.connect("orders", listener);
        sink.deliver(event("in-flight", new Object()));
        assertThat(publishing.await(5, TimeUnit.SECONDS)).isTrue();
        sink.deliver(event("queued", queuedRef));

        Thread closer = new Thread(pipeline::close);
        closer.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (pipeline.isRunning() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        release.countDown();
        closer.join(15000);

        verify(listener, timeout(5000)).onOutcome(queuedRef, false);
        assertThat(pipeline.isRunning()).isFalse();
        assertThat(sink.deliver(event("late", null))).isFalse();
    }
}

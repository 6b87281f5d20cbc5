/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.pipeline;

import com.subingest.common.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded in-process pipeline shared by all inputs.
 *
 * <p>{@link EventSink#deliver(Event)} never blocks: when the queue is full or
 * the pipeline is paused the event is rejected and the input applies its
 * backpressure policy. Publisher threads drain the queue, hand each event to
 * the {@link EventPublisher} and report the outcome to the listener of the
 * connection that delivered it. Events still queued when the pipeline stops
 * are reported as failed.</p>
 */
public class BufferedEventPipeline implements PipelineConnector, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BufferedEventPipeline.class);

    private record Entry(Event event, AckListener listener) {}

    private final BlockingQueue<Entry> queue;
    private final EventPublisher publisher;
    private final int publisherThreads;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicInteger connections = new AtomicInteger();
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private ExecutorService executor;

    public BufferedEventPipeline(int capacity, int publisherThreads, EventPublisher publisher) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be at least 1");
        if (publisherThreads < 1) throw new IllegalArgumentException("publisherThreads must be at least 1");
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.publisherThreads = publisherThreads;
        this.publisher = publisher;
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) return;
        AtomicInteger seq = new AtomicInteger();
        executor = Executors.newFixedThreadPool(publisherThreads, r -> {
            Thread t = new Thread(r, "pipeline-publisher-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < publisherThreads; i++) {
            executor.submit(this::drainLoop);
        }
        log.info("Event pipeline started (capacity={}, publishers={}, publisher={})",
                queue.remainingCapacity() + queue.size(), publisherThreads, publisher.getClass().getSimpleName());
    }

    @Override
    public EventSink connect(String inputId, AckListener ackListener) {
        if (!running.get()) {
            throw new IllegalStateException("Event pipeline is not running");
        }
        connections.incrementAndGet();
        log.debug("Input [{}] connected to event pipeline", inputId);
        return new Connection(inputId, ackListener);
    }

    /**
     * Reject every delivery until {@link #resume()}, as a downstream outage would.
     */
    public void pause() {
        if (paused.compareAndSet(false, true)) log.warn("Event pipeline paused, deliveries will be rejected");
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) log.info("Event pipeline resumed");
    }

    private void drainLoop() {
        while (running.get() || !queue.isEmpty()) {
            Entry entry;
            try {
                entry = queue.poll(100, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (entry == null) continue;
            if (!running.get()) {
                report(entry, false);
                continue;
            }
            boolean ok;
            try {
                publisher.publish(entry.event());
                ok = true;
                published.incrementAndGet();
            } catch (Exception e) {
                ok = false;
                failed.incrementAndGet();
                log.warn("Publishing event {} failed: {}", entry.event().getId(), e.getMessage());
            }
            report(entry, ok);
        }
    }

    private void report(Entry entry, boolean success) {
        try {
            entry.listener().onOutcome(entry.event().getPrivateRef(), success);
        } catch (RuntimeException e) {
            log.error("Ack listener failed for event {}", entry.event().getId(), e);
        }
    }

    @Override
    public synchronized void close() {
        if (!running.compareAndSet(true, false)) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        List<Entry> leftover = new ArrayList<>();
        queue.drainTo(leftover);
        leftover.forEach(entry -> report(entry, false));
        log.info("Event pipeline stopped (published={}, failed={}, rejected={}, dropped={})",
                published.get(), failed.get(), rejected.get(), leftover.size());
    }

    public boolean isRunning() { return running.get(); }
    public boolean isPaused() { return paused.get(); }
    public int getQueueDepth() { return queue.size(); }
    public int getConnectionCount() { return connections.get(); }
    public long getAcceptedCount() { return accepted.get(); }
    public long getRejectedCount() { return rejected.get(); }
    public long getPublishedCount() { return published.get(); }
    public long getFailedCount() { return failed.get(); }

    private final class Connection implements EventSink {
        private final String inputId;
        private final AckListener listener;
        private final AtomicBoolean open = new AtomicBoolean(true);

        Connection(String inputId, AckListener listener) {
            this.inputId = inputId;
            this.listener = listener;
        }

        @Override
        public boolean deliver(Event event) {
            if (!open.get() || !running.get() || paused.get() || !queue.offer(new Entry(event, listener))) {
                rejected.incrementAndGet();
                return false;
            }
            accepted.incrementAndGet();
            return true;
        }

        @Override
        public void close() {
            if (open.compareAndSet(true, false)) {
                connections.decrementAndGet();
                log.debug("Input [{}] disconnected from event pipeline", inputId);
            }
        }
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input.pubsub;

import com.subingest.common.concurrent.CancellationScope;
import com.subingest.common.config.WorkerConfig;
import com.subingest.common.exception.ConfigurationException;
import com.subingest.common.model.WorkerState;
import com.subingest.messaging.core.ClientOptions;
import com.subingest.messaging.core.MessageSourceClient;
import com.subingest.messaging.core.ReceiveSettings;
import com.subingest.messaging.core.Subscription;
import com.subingest.server.input.Input;
import com.subingest.server.input.InputContext;
import com.subingest.server.input.InputRegistry;
import com.subingest.server.metrics.InputMetrics;
import com.subingest.server.pipeline.EventSink;
import com.subingest.server.status.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pub/Sub input worker.
 *
 * <p>{@link #run()} starts the supervising {@link RetryWatchdog} on its own
 * thread and returns; only the first call has an effect. {@link #stop()}
 * cancels the worker scope and blocks until the watchdog has exited, then
 * detaches from the pipeline and unregisters the metrics. Concurrent and
 * repeated {@code stop()} calls all wait for the same shutdown.</p>
 *
 * <pre>
 *   PubSubInput input = PubSubInput.create(configTree, context);
 *   input.run();
 *   ...
 *   input.stop();
 * </pre>
 */
public class PubSubInput implements Input {

    public static final String TYPE = "gcp-pubsub";
    public static final String DEPRECATED_TYPE = "google-pubsub";

    private static final Logger log = LoggerFactory.getLogger(PubSubInput.class);

    private final WorkerConfig config;
    private final InputContext context;
    private final WorkerStatus status;
    private final InputMetrics metrics;
    private final EventSink sink;
    private final String logPrefix;
    private final SubscriptionManager subscriptionManager = new SubscriptionManager();
    private final MessagePump pump;
    private final RetryWatchdog watchdog;
    private final CancellationScope workerScope = CancellationScope.root();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch exited = new CountDownLatch(1);
    private final CompletableFuture<Void> stopped = new CompletableFuture<>();
    private volatile Instant startedAt;

    /**
     * Register this input under {@value #TYPE} and the deprecated {@value #DEPRECATED_TYPE}.
     */
    public static void register(InputRegistry registry) {
        registry.register(TYPE, PubSubInput::create);
        registry.register(DEPRECATED_TYPE, (tree, ctx) -> {
            log.warn("Input type '{}' is deprecated, use '{}' instead", DEPRECATED_TYPE, TYPE);
            return create(tree, ctx);
        });
    }

    /**
     * Parse and validate the configuration tree and construct the worker.
     *
     * @throws ConfigurationException if the configuration is invalid; Failed is reported first
     */
    public static PubSubInput create(Map<String, Object> tree, InputContext context) {
        WorkerStatus status = configuring(context);
        WorkerConfig config;
        try {
            config = WorkerConfig.fromMap(tree);
        } catch (ConfigurationException e) {
            status.updateStatus(WorkerState.FAILED, "failed to configure input: " + e.getMessage());
            throw e;
        }
        return new PubSubInput(config, context, status);
    }

    public PubSubInput(WorkerConfig config, InputContext context) {
        this(config, context, configuring(context));
    }

    private PubSubInput(WorkerConfig config, InputContext context, WorkerStatus status) {
        this.config = config;
        this.context = context;
        this.status = status;
        this.logPrefix = String.format("[%s project=%s topic=%s subscription=%s]",
                config.getId(), config.getProjectId(), config.getTopic(), config.getSubscriptionName());
        this.metrics = new InputMetrics(config.getId(), context.getMeterRegistry());

        AckBridge ackBridge = new AckBridge(logPrefix, metrics);
        try {
            this.sink = context.getPipeline().connect(config.getId(), ackBridge);
        } catch (RuntimeException e) {
            status.updateStatus(WorkerState.FAILED, "failed to connect to the pipeline: " + e.getMessage());
            metrics.close();
            throw e;
        }

        this.pump = new MessagePump(logPrefix, config.getProjectId(), config.getTopic(),
                new EventMapper(config.getProjectId(), config.getTopic()), sink, metrics, status);
        this.watchdog = new RetryWatchdog(logPrefix, workerScope,
                new RestartThrottle(config.getRetryInterval()), this::runAttempt, status);
        log.info("{} Initialized Pub/Sub input (create={}, parallel_pull={}, max_outstanding={}, retry_interval={})",
                logPrefix, config.isSubscriptionCreate(), config.getNumGoroutines(),
                config.getMaxOutstandingMessages(), config.getRetryInterval());
    }

    private static WorkerStatus configuring(InputContext context) {
        WorkerStatus status = new WorkerStatus(context.statusReporter());
        status.updateStatus(WorkerState.STARTING, "");
        status.updateStatus(WorkerState.CONFIGURING, "");
        return status;
    }

    // ─── Lifecycle ──────────────────────────────────────────────────

    @Override
    public void run() {
        if (!started.compareAndSet(false, true)) return;
        startedAt = Instant.now();
        Thread worker = new Thread(() -> {
            try {
                watchdog.run();
            } finally {
                exited.countDown();
            }
        }, "pubsub-input-" + config.getId());
        worker.setDaemon(true);
        worker.start();
        log.info("{} Input worker started", logPrefix);
    }

    @Override
    public void stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            stopped.join();
            return;
        }
        try {
            status.updateStatus(WorkerState.STOPPING, "");
            workerScope.cancel("input stopped");
            if (started.compareAndSet(false, true)) {
                // never ran, nothing to wait for
                status.updateStatus(WorkerState.STOPPED, "");
            } else {
                awaitExit();
            }
            sink.close();
            metrics.close();
            log.info("{} Input worker stopped", logPrefix);
        } finally {
            stopped.complete(null);
        }
    }

    private void awaitExit() {
        boolean interrupted = false;
        while (true) {
            try {
                exited.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }

    /**
     * One attempt: fresh client, subscription, receive until the attempt
     * scope is cancelled or the source fails.
     */
    void runAttempt(CancellationScope attempt) {
        try (MessageSourceClient client = newClient()) {
            Subscription subscription;
            try {
                subscription = subscriptionManager.ensureSubscription(client, config.getSubscriptionName(),
                        config.getTopic(), config.isSubscriptionCreate());
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                status.updateStatus(WorkerState.DEGRADED, "failed to subscribe to pub/sub topic: " + e.getMessage());
                throw e;
            }
            status.updateStatus(WorkerState.RUNNING, "");
            pump.receive(attempt, subscription,
                    new ReceiveSettings(config.getNumGoroutines(), config.getMaxOutstandingMessages()));
        }
    }

    private MessageSourceClient newClient() {
        try {
            return context.getClientFactory().create(ClientOptions.from(config, context.userAgent()));
        } catch (RuntimeException e) {
            status.updateStatus(WorkerState.DEGRADED, "failed to create pub/sub client: " + e.getMessage());
            throw e;
        }
    }

    // ─── Accessors ──────────────────────────────────────────────────

    @Override
    public String getId() { return config.getId(); }

    @Override
    public String getType() { return config.getType() != null ? config.getType() : TYPE; }

    @Override
    public WorkerState getState() { return status.getState(); }

    @Override
    public InputStats getStats() {
        return new InputStats(
                config.getId(), getType(), status.getState(), status.getDetail(),
                config.getProjectId() + "/" + config.getTopic() + "/" + config.getSubscriptionName(),
                metrics.getAckedCount(), metrics.getFailedAckedCount(), metrics.getNackedCount(),
                metrics.getBytesProcessed(), watchdog.getAttempts(),
                startedAt, status.getUpdatedAt());
    }

    public WorkerConfig getConfig() { return config; }
    public WorkerStatus getStatus() { return status; }
    public InputMetrics getMetrics() { return metrics; }
    public boolean isStarted() { return started.get() && !stopRequested.get(); }
}

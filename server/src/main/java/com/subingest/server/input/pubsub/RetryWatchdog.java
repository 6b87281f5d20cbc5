/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input.pubsub;

import com.subingest.common.concurrent.CancellationScope;
import com.subingest.common.model.WorkerState;
import com.subingest.server.status.StatusReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Supervising loop of an input worker.
 *
 * <p>Runs attempts one after another until the worker scope is cancelled.
 * Each attempt gets a fresh child scope, so an attempt that cancels itself
 * (backpressure) only ends that attempt. Whether a finished attempt was a
 * restart or a shutdown is decided solely by the worker scope:</p>
 * <ul>
 *   <li>worker scope active: the error, if any, is transient and logged as a warning</li>
 *   <li>worker scope cancelled: a {@link CancellationException}, also when
 *       wrapped, is a clean shutdown, any other error is logged as a final failure</li>
 * </ul>
 * <p>On exit the worker scope is cancelled and Stopped is reported.</p>
 */
public class RetryWatchdog implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RetryWatchdog.class);

    /** One run attempt: acquire a client, resolve the subscription, receive. */
    @FunctionalInterface
    public interface Attempt {
        void run(CancellationScope attemptScope);
    }

    private final String logPrefix;
    private final CancellationScope workerScope;
    private final RestartThrottle throttle;
    private final Attempt attempt;
    private final StatusReporter status;
    private final AtomicLong attempts = new AtomicLong();
    private final AtomicReference<Throwable> lastError = new AtomicReference<>();

    public RetryWatchdog(String logPrefix, CancellationScope workerScope, RestartThrottle throttle,
                         Attempt attempt, StatusReporter status) {
        this.logPrefix = logPrefix;
        this.workerScope = workerScope;
        this.throttle = throttle;
        this.attempt = attempt;
        this.status = status;
    }

    @Override
    public void run() {
        try {
            while (!workerScope.isCancelled()) {
                if (!throttle.acquire(workerScope)) {
                    if (Thread.currentThread().isInterrupted()) {
                        workerScope.cancel("input worker interrupted");
                    }
                    continue;
                }
                runOnce();
            }
        } finally {
            workerScope.cancel("input worker exited");
            status.updateStatus(WorkerState.STOPPED, "");
            log.info("{} Input worker exited after {} attempt(s)", logPrefix, attempts.get());
        }
    }

    private void runOnce() {
        long n = attempts.incrementAndGet();
        CancellationScope attemptScope = workerScope.child();
        log.debug("{} Starting attempt #{}", logPrefix, n);
        try {
            attempt.run(attemptScope);
        } catch (RuntimeException e) {
            lastError.set(e);
            if (!workerScope.isCancelled() && attemptScope.isCancelled() && isCancellation(e)) {
                log.debug("{} Attempt #{} cancelled: {}", logPrefix, n, attemptScope.getReason());
            } else if (!workerScope.isCancelled()) {
                log.warn("{} Restarting failed Pub/Sub input worker: {}", logPrefix, e.getMessage(), e);
            } else if (!isCancellation(e)) {
                log.error("{} Pub/Sub input worker failed: {}", logPrefix, e.getMessage(), e);
            }
        } finally {
            attemptScope.cancel("attempt finished");
        }
    }

    /** True if {@code e} or any of its causes is a {@link CancellationException}. */
    static boolean isCancellation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof CancellationException) return true;
        }
        return false;
    }

    public long getAttempts() { return attempts.get(); }

    public Throwable getLastError() { return lastError.get(); }
}

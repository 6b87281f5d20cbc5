/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hierarchical cancellation token.
 *
 * <p>A worker owns one root scope for its whole lifetime and derives a child
 * scope for every run attempt. Cancelling a scope cancels all of its
 * descendants; cancelling a child never affects its parent. Cancellation is
 * one-way and happens at most once, the first reason wins.</p>
 *
 * <pre>
 *   CancellationScope worker = CancellationScope.root();
 *   CancellationScope attempt = worker.child();
 *   attempt.cancel("backpressure");   // worker still active
 *   worker.cancel("shutdown");        // every child cancelled too
 * </pre>
 */
public final class CancellationScope {

    private static final Logger log = LoggerFactory.getLogger(CancellationScope.class);

    private final CancellationScope parent;
    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<CancellationScope> children = new CopyOnWriteArrayList<>();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    private CancellationScope(CancellationScope parent) {
        this.parent = parent;
    }

    public static CancellationScope root() {
        return new CancellationScope(null);
    }

    /**
     * Create a scope that is cancelled whenever this one is. A child created
     * from an already cancelled scope starts out cancelled.
     */
    public CancellationScope child() {
        CancellationScope child = new CancellationScope(this);
        children.add(child);
        String r = reason.get();
        if (r != null) child.cancel(r);
        return child;
    }

    /**
     * Cancel this scope and every descendant. Subsequent calls are no-ops.
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel(String why) {
        if (!reason.compareAndSet(null, why != null ? why : "cancelled")) return false;
        latch.countDown();
        for (CancellationScope child : children) {
            child.cancel(why);
        }
        children.clear();
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) runCallback(callback);
        }
        if (parent != null) parent.children.remove(this);
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /** Reason given to the first {@link #cancel(String)}, or null while active. */
    public String getReason() {
        return reason.get();
    }

    /**
     * Register a callback invoked exactly once when this scope is cancelled.
     * If the scope is already cancelled the callback runs immediately on the
     * calling thread.
     *
     * @return an action that unregisters the callback
     */
    public Runnable onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            runCallback(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Block until the scope is cancelled or the timeout elapses.
     *
     * @return true if the scope was cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void awaitCancellation() throws InterruptedException {
        latch.await();
    }

    public void throwIfCancelled() {
        String r = reason.get();
        if (r != null) throw new CancellationException(r);
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}

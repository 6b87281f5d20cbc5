/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input.pubsub;

import com.subingest.common.concurrent.CancellationScope;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Gate that lets at most one attempt start per interval, with a burst of one:
 * the first {@link #acquire} passes immediately, every later one waits until
 * the interval has elapsed since the previous pass.
 */
public class RestartThrottle {

    private final long intervalNanos;
    private final LongSupplier nanoClock;
    private long lastPass;
    private boolean passed;

    public RestartThrottle(Duration interval) {
        this(interval, System::nanoTime);
    }

    RestartThrottle(Duration interval, LongSupplier nanoClock) {
        this.intervalNanos = interval.toNanos();
        this.nanoClock = nanoClock;
    }

    /**
     * Wait for the next permitted start.
     *
     * @return false if {@code scope} was cancelled before the start was permitted
     */
    public synchronized boolean acquire(CancellationScope scope) {
        while (!scope.isCancelled()) {
            long now = nanoClock.getAsLong();
            long remaining = passed ? intervalNanos - (now - lastPass) : 0;
            if (remaining <= 0) {
                lastPass = now;
                passed = true;
                return true;
            }
            try {
                if (scope.await(Duration.ofNanos(remaining))) return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }

    /**
     * Time until {@link #acquire} would pass, zero if it would pass now.
     */
    public synchronized Duration timeUntilNextPass() {
        if (!passed) return Duration.ZERO;
        long remaining = intervalNanos - (nanoClock.getAsLong() - lastPass);
        return remaining > 0 ? Duration.ofNanos(remaining) : Duration.ZERO;
    }
}

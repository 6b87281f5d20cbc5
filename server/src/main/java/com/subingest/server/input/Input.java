/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input;

import com.subingest.common.model.WorkerState;

import java.time.Instant;

/**
 * Contract for a long-lived input worker hosted by the pipeline.
 */
public interface Input {

    /** Unique identifier, used as the metrics tag. */
    String getId();

    /** Registered type name. */
    String getType();

    /** Start consuming. Non-blocking; only the first call has an effect. */
    void run();

    /** Cancel all work and block until it has fully stopped. Safe to call repeatedly. */
    void stop();

    /** Same as {@link #stop()}. */
    default void awaitStopped() {
        stop();
    }

    WorkerState getState();

    /** Get runtime statistics. */
    InputStats getStats();

    // ─── Types ──────────────────────────────────────────────────────────

    record InputStats(
            String id,
            String type,
            WorkerState state,
            String detail,
            String source,
            long acked,
            long failedAcks,
            long nacked,
            long bytesProcessed,
            long attempts,
            Instant startedAt,
            Instant stateChangedAt
    ) {}
}

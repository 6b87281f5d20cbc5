/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.pipeline;

import com.subingest.common.model.Event;

/**
 * Downstream consumer of events produced by an input.
 */
public interface EventSink extends AutoCloseable {

    /**
     * Hand one event to the pipeline. Must not block for long.
     *
     * @return false if the pipeline cannot take the event right now
     */
    boolean deliver(Event event);

    /**
     * Detach from the pipeline; later deliveries are rejected.
     */
    @Override
    default void close() {}
}

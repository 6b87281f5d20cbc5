/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.pipeline;

import com.subingest.common.model.Event;

/**
 * Final destination of accepted events.
 */
@FunctionalInterface
public interface EventPublisher {

    /**
     * @throws Exception if the event could not be published; the pipeline
     *                   reports the event as failed
     */
    void publish(Event event) throws Exception;
}

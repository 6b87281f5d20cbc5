/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.pipeline;

/**
 * Host-side entry point an input uses to obtain its sink.
 */
@FunctionalInterface
public interface PipelineConnector {

    /**
     * @throws IllegalStateException if the pipeline cannot accept a new client
     */
    EventSink connect(String inputId, AckListener ackListener);
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.pipeline;

/**
 * Receives the final outcome of every event the pipeline accepted, carrying
 * back the event's private reference. Called at most once per event, from
 * pipeline threads, in no particular order.
 */
@FunctionalInterface
public interface AckListener {

    void onOutcome(Object privateRef, boolean success);
}

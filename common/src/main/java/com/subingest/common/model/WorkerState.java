/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.model;

/**
 * Lifecycle phase of an input worker as seen by external observers.
 * Degraded and Running may alternate across restarts; Stopped and Failed
 * are final for the lifetime of a worker.
 */
public enum WorkerState {
    STARTING, CONFIGURING, RUNNING, DEGRADED, STOPPING, STOPPED, FAILED;

    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.status;

import com.subingest.common.model.WorkerState;

/**
 * Receives lifecycle transitions of an input worker. Implementations must
 * return quickly and must not throw.
 */
@FunctionalInterface
public interface StatusReporter {

    void updateStatus(WorkerState state, String detail);
}

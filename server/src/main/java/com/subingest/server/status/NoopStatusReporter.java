/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.status;

import com.subingest.common.model.WorkerState;

/**
 * Reporter used when the host supplies none.
 */
public final class NoopStatusReporter implements StatusReporter {

    public static final NoopStatusReporter INSTANCE = new NoopStatusReporter();

    private NoopStatusReporter() {}

    @Override
    public void updateStatus(WorkerState state, String detail) {
        // nothing to report to
    }
}

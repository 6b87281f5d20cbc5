/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.core;

/**
 * Flow-control hints applied to a subscription before receiving.
 *
 * @param parallelPullCount      number of parallel receive streams, at least 1
 * @param maxOutstandingMessages max delivered-but-unsettled messages; negative means unlimited
 */
public record ReceiveSettings(int parallelPullCount, int maxOutstandingMessages) {

    public static final ReceiveSettings DEFAULT = new ReceiveSettings(1, 1000);

    public ReceiveSettings {
        if (parallelPullCount < 1) {
            throw new IllegalArgumentException("parallelPullCount must be at least 1");
        }
        if (maxOutstandingMessages == 0) {
            throw new IllegalArgumentException("maxOutstandingMessages must be non-zero");
        }
    }

    public boolean isOutstandingUnbounded() {
        return maxOutstandingMessages < 0;
    }
}

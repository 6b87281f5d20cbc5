/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.core;

/**
 * Callback invoked once per inbound message. Implementations may be called
 * from several receiver threads at once.
 */
@FunctionalInterface
public interface MessageHandler {
    void onMessage(SourceMessage message);
}

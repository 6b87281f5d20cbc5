/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.core;

import com.subingest.common.concurrent.CancellationScope;
import com.subingest.common.exception.MessageSourceException;

/**
 * Handle on a named subscription of the message source.
 */
public interface Subscription {

    String getName();

    ReceiveSettings getReceiveSettings();

    void setReceiveSettings(ReceiveSettings settings);

    /**
     * Pull messages and hand each one to {@code handler} until {@code scope}
     * is cancelled. Returns normally on cancellation.
     *
     * @throws MessageSourceException if the source reports a fatal receive error
     */
    void receive(CancellationScope scope, MessageHandler handler);
}

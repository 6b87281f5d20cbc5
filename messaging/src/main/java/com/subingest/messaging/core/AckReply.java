/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.core;

/**
 * Settles one delivery on the message source side.
 */
@FunctionalInterface
public interface AckReply {

    /**
     * @param ack true to acknowledge, false to request redelivery
     */
    void reply(boolean ack);
}

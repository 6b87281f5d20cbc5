/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.core;

import com.subingest.common.exception.MessageSourceException;

/**
 * Connection to a publish/subscribe message source. A client is owned by a
 * single run attempt and closed when the attempt ends.
 */
public interface MessageSourceClient extends AutoCloseable {

    /**
     * @throws MessageSourceException if existence cannot be determined
     */
    boolean subscriptionExists(String name);

    /**
     * Handle on an existing subscription; does not contact the source.
     */
    Subscription subscription(String name);

    /**
     * @throws MessageSourceException if the subscription cannot be created
     */
    Subscription createSubscription(String name, String topic);

    @Override
    void close();
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input.pubsub;

import com.subingest.common.exception.MessageSourceException;
import com.subingest.common.exception.SubscriptionUnavailableException;
import com.subingest.messaging.core.MessageSourceClient;
import com.subingest.messaging.core.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;

/**
 * Resolves the subscription an attempt receives from, creating it on the
 * topic when it is missing and creation is allowed.
 */
public class SubscriptionManager {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionManager.class);

    /**
     * @throws SubscriptionUnavailableException if the subscription is missing and may not be created
     * @throws MessageSourceException           if the source fails to answer or to create it
     * @throws CancellationException             unwrapped, if a call was cancelled
     */
    public Subscription ensureSubscription(MessageSourceClient client, String name, String topic,
                                           boolean createIfMissing) {
        boolean exists;
        try {
            exists = client.subscriptionExists(name);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MessageSourceException("failed to check if subscription exists: " + e.getMessage(), e);
        }
        if (exists) {
            return client.subscription(name);
        }
        if (!createIfMissing) {
            throw new SubscriptionUnavailableException(name);
        }

        try {
            Subscription subscription = client.createSubscription(name, topic);
            log.debug("Created new subscription {} on topic {}", name, topic);
            return subscription;
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MessageSourceException("failed to create subscription: " + e.getMessage(), e);
        }
    }
}

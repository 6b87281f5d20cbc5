/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.exception;

public class SubscriptionUnavailableException extends SubIngestException {
    private final String subscription;

    public SubscriptionUnavailableException(String subscription) {
        super("SI_SUBSCRIPTION_UNAVAILABLE",
                "no subscription exists and 'subscription.create' is not enabled: " + subscription);
        this.subscription = subscription;
    }

    public String getSubscription() { return subscription; }
}

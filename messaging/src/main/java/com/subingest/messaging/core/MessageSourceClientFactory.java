/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.core;

@FunctionalInterface
public interface MessageSourceClientFactory {
    MessageSourceClient create(ClientOptions options);
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.core;

/**
 * Service provider for a message-source backend, discovered through
 * {@link java.util.ServiceLoader}. The scheme selects the provider: an
 * endpoint {@code memory://local} picks the provider whose scheme is
 * {@code memory}.
 */
public interface MessageSourceProvider extends MessageSourceClientFactory {

    String scheme();
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.memory;

import com.subingest.messaging.core.ClientOptions;
import com.subingest.messaging.core.MessageSourceClient;
import com.subingest.messaging.core.MessageSourceProvider;

/**
 * Handles endpoints of the form {@code memory://<name>}.
 */
public class InMemoryMessageSourceProvider implements MessageSourceProvider {

    public static final String SCHEME = "memory";

    @Override
    public String scheme() {
        return SCHEME;
    }

    @Override
    public MessageSourceClient create(ClientOptions options) {
        String address = options.endpointAddress();
        String name = address == null || address.isBlank() ? "default" : address;
        return new InMemoryMessageSourceClient(InMemoryMessageSource.named(name));
    }
}

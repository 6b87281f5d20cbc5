/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.config;

import com.subingest.common.exception.ConfigurationException;
import com.subingest.messaging.core.ClientOptions;
import com.subingest.messaging.core.MessageSourceClient;
import com.subingest.messaging.core.MessageSourceClientFactory;
import com.subingest.messaging.core.MessageSourceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates message-source clients through the providers found on the class
 * path. The scheme of the alternate endpoint picks the provider; without an
 * endpoint the {@value #DEFAULT_SCHEME} provider is used.
 */
public final class MessagingFactory implements MessageSourceClientFactory {

    public static final String DEFAULT_SCHEME = "pubsub";

    private static final Logger log = LoggerFactory.getLogger(MessagingFactory.class);

    private final Map<String, MessageSourceProvider> providers = new ConcurrentHashMap<>();

    public MessagingFactory() {
        this(MessagingFactory.class.getClassLoader());
    }

    public MessagingFactory(ClassLoader classLoader) {
        for (MessageSourceProvider provider : ServiceLoader.load(MessageSourceProvider.class, classLoader)) {
            register(provider);
        }
    }

    public void register(MessageSourceProvider provider) {
        String scheme = provider.scheme().toLowerCase(Locale.ROOT);
        MessageSourceProvider previous = providers.put(scheme, provider);
        if (previous != null) {
            log.warn("Message source provider for scheme '{}' replaced: {} -> {}",
                    scheme, previous.getClass().getName(), provider.getClass().getName());
        } else {
            log.info("Registered message source provider '{}' ({})", scheme, provider.getClass().getName());
        }
    }

    public Set<String> schemes() {
        return Set.copyOf(providers.keySet());
    }

    /**
     * @throws ConfigurationException if no provider handles the endpoint's scheme
     */
    @Override
    public MessageSourceClient create(ClientOptions options) {
        String scheme = options.endpointScheme();
        if (scheme == null) scheme = DEFAULT_SCHEME;
        MessageSourceProvider provider = providers.get(scheme.toLowerCase(Locale.ROOT));
        if (provider == null) {
            throw new ConfigurationException("No message source provider for scheme '" + scheme
                    + "' (available: " + providers.keySet() + ")");
        }
        return provider.create(options);
    }
}

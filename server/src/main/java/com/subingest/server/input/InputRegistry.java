/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input;

import com.subingest.common.exception.ConfigurationException;
import com.subingest.common.exception.InputRegistrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Input types known to the host, keyed by the {@code type} value of an
 * input configuration.
 */
public class InputRegistry {

    private static final Logger log = LoggerFactory.getLogger(InputRegistry.class);

    private final Map<String, InputFactory> factories = new ConcurrentHashMap<>();

    /**
     * @throws InputRegistrationException if the name is blank or already taken
     */
    public void register(String name, InputFactory factory) {
        if (name == null || name.isBlank()) {
            throw new InputRegistrationException("Input type name must not be blank");
        }
        if (factories.putIfAbsent(name, factory) != null) {
            throw new InputRegistrationException("Input type '" + name + "' is already registered");
        }
        log.debug("Registered input type '{}'", name);
    }

    /**
     * @throws InputRegistrationException if no factory is registered under {@code name}
     */
    public InputFactory lookup(String name) {
        InputFactory factory = factories.get(name);
        if (factory == null) {
            throw new InputRegistrationException("Unknown input type '" + name + "' (registered: " + names() + ")");
        }
        return factory;
    }

    public boolean isRegistered(String name) {
        return factories.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(factories.keySet());
    }

    /**
     * Construct an input from a configuration tree using its {@code type} entry.
     */
    public Input create(Map<String, Object> config, InputContext context) {
        Object type = config.get("type");
        if (type == null || type.toString().isBlank()) {
            throw new ConfigurationException("missing required field 'type'");
        }
        return lookup(type.toString().trim()).create(config, context);
    }
}

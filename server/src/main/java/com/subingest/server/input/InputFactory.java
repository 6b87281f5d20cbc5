/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input;

import java.util.Map;

/**
 * Constructs an input from its configuration tree.
 */
@FunctionalInterface
public interface InputFactory {

    /**
     * @throws com.subingest.common.exception.ConfigurationException if the configuration is invalid
     */
    Input create(Map<String, Object> config, InputContext context);
}

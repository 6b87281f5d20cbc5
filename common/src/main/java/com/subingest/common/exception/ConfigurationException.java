/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.exception;

/**
 * Thrown when an input configuration is missing required values or combines
 * options that cannot be used together.
 */
public class ConfigurationException extends SubIngestException {
    public ConfigurationException(String message) {
        super("SI_CONFIG_INVALID", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("SI_CONFIG_INVALID", message, cause);
    }
}

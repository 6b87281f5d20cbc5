/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.exception;

/**
 * Failure reported by a message-source client while checking, creating or
 * receiving from a subscription. Always treated as transient.
 */
public class MessageSourceException extends SubIngestException {
    public MessageSourceException(String message) {
        super("SI_SOURCE_ERROR", message);
    }

    public MessageSourceException(String message, Throwable cause) {
        super("SI_SOURCE_ERROR", message, cause);
    }
}

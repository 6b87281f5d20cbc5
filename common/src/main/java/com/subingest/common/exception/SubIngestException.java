/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.exception;

/**
 * Base exception for all SubIngest errors.
 */
public class SubIngestException extends RuntimeException {
    private final String errorCode;

    public SubIngestException(String message) {
        super(message);
        this.errorCode = "SI_GENERIC";
    }

    public SubIngestException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SubIngestException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}

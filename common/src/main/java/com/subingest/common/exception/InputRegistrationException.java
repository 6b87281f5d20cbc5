/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.exception;

public class InputRegistrationException extends SubIngestException {
    public InputRegistrationException(String message) {
        super("SI_INPUT_REGISTRATION", message);
    }
}

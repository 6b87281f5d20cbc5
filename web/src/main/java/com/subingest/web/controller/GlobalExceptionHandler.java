/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.web.controller;

import com.subingest.common.exception.ConfigurationException;
import com.subingest.common.exception.InputRegistrationException;
import com.subingest.common.exception.SubIngestException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for the SubIngest REST API.
 *
 * <p>Renders every unhandled controller exception as a JSON error body
 * carrying the HTTP status, the error code of {@link SubIngestException}s and
 * the request that failed.</p>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @Value("${subingest.app-name:SubIngest}")
    private String appName;

    @Value("${subingest.version:1.0.0}")
    private String version;

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception ex, HttpServletRequest request) {
        int statusCode = resolveStatusCode(ex);
        if (statusCode >= 500) {
            log.error("Unhandled exception at {} {}: {}", request.getMethod(),
                    request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.warn("Request {} {} rejected: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("status", statusCode);
        body.put("error", HttpStatus.valueOf(statusCode).getReasonPhrase());
        body.put("exceptionType", ex.getClass().getSimpleName());
        if (ex instanceof SubIngestException sie) {
            body.put("errorCode", sie.getErrorCode());
        }
        body.put("message", ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred");
        body.put("path", request.getRequestURI());
        body.put("timestamp", LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS")));
        body.put("server", appName + " v" + version);
        return ResponseEntity.status(statusCode).body(body);
    }

    private int resolveStatusCode(Exception ex) {
        if (ex instanceof ConfigurationException) return 400;
        if (ex instanceof InputRegistrationException) return 400;
        if (ex instanceof IllegalArgumentException) return 400;
        if (ex instanceof SecurityException) return 403;
        return 500;
    }
}

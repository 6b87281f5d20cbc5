/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.util;

import java.time.Duration;
import java.util.Locale;

public final class Durations {

    private Durations() {}

    /**
     * Parse a human-friendly duration.
     * <ul>
     *   <li>{@code "500ms"} → 500 milliseconds</li>
     *   <li>{@code "30s"} → 30 seconds</li>
     *   <li>{@code "5m"} → 5 minutes</li>
     *   <li>{@code "2h"} → 2 hours</li>
     *   <li>ISO-8601 ({@code "PT30S"})</li>
     *   <li>plain number → milliseconds</li>
     * </ul>
     *
     * @throws IllegalArgumentException if the value cannot be parsed
     */
    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("empty duration");
        }
        String val = value.trim().toLowerCase(Locale.ROOT);
        try {
            if (val.startsWith("pt")) return Duration.parse(val.toUpperCase(Locale.ROOT));
            if (val.endsWith("ms")) return Duration.ofMillis(number(val, 2));
            if (val.endsWith("s"))  return Duration.ofSeconds(number(val, 1));
            if (val.endsWith("m"))  return Duration.ofMinutes(number(val, 1));
            if (val.endsWith("h"))  return Duration.ofHours(number(val, 1));
            return Duration.ofMillis(Long.parseLong(val));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("invalid duration '" + value + "'", e);
        }
    }

    private static long number(String val, int suffixLength) {
        return Long.parseLong(val.substring(0, val.length() - suffixLength).trim());
    }
}

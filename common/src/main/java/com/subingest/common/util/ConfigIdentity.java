/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.util;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Derives a stable identifier for an input whose configuration carries no
 * explicit {@code id}. Two configuration trees with the same content (in any
 * key order) get the same identifier.
 */
public final class ConfigIdentity {

    public static final int ID_LENGTH = 16;

    private ConfigIdentity() {}

    public static String derive(Map<String, Object> config) {
        String canonical = JsonUtil.toCompactJson(config);
        return HashUtil.sha256Hex(canonical.getBytes(StandardCharsets.UTF_8))
                .substring(0, ID_LENGTH)
                .toUpperCase(Locale.ROOT);
    }

    /**
     * The explicit {@code id} entry when present and non-blank, otherwise {@link #derive(Map)}.
     */
    public static String resolve(Map<String, Object> config) {
        Object explicit = config.get("id");
        if (explicit != null && !explicit.toString().isBlank()) {
            return explicit.toString().trim();
        }
        return derive(config);
    }
}

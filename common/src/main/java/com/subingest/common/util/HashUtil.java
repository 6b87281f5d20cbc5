/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtil {

    private HashUtil() {}

    /**
     * SHA-256 over the concatenation of the given strings (UTF-8), as lower-case hex.
     */
    public static String sha256Hex(String... parts) {
        MessageDigest md = sha256();
        for (String part : parts) {
            if (part != null) md.update(part.getBytes(StandardCharsets.UTF_8));
        }
        return toHex(md.digest());
    }

    public static String sha256Hex(byte[] data) {
        return toHex(sha256().digest(data));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] hash) {
        StringBuilder sb = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}

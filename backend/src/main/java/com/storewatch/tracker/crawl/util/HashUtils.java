package com.storewatch.tracker.crawl.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtils {
    private static final int SHORT_DIGEST_LENGTH = 16;

    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * First 64 bits of the SHA-256 of {@code value}; {@code null} for blank input.
     */
    public static String shortDigest(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return sha256Hex(value.trim()).substring(0, SHORT_DIGEST_LENGTH);
    }
}

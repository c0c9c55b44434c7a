package com.worldsentinel.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashingUtils {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private HashingUtils() {
    }

    public static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return toHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Short, stable identifier derived from the given parts. Parts are joined with a unit separator
     * so that ("ab", "c") and ("a", "bc") never collide.
     */
    public static String shortId(String prefix, String... parts) {
        String joined = String.join("\u001f", parts);
        return prefix + "-" + sha256(joined).substring(0, 16);
    }

    private static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0f];
        }
        return new String(out);
    }
}

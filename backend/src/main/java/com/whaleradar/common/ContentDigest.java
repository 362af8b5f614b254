package com.whaleradar.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprints for idempotency keys. Each part is hashed followed by a '|' separator so that
 * ("ab", "c") and ("a", "bc") never collide; null parts hash as empty strings.
 */
public final class ContentDigest {

    private static final byte[] SEPARATOR = "|".getBytes(StandardCharsets.UTF_8);

    private ContentDigest() {
    }

    public static String sha256(String... parts) {
        MessageDigest digest = newDigest();
        for (String part : parts) {
            digest.update((part != null ? part : "").getBytes(StandardCharsets.UTF_8));
            digest.update(SEPARATOR);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.phillippitts.catalogintel.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-1 fingerprints used for cache file names, deterministic vision labels and message ids.
 * Not used for anything security-sensitive.
 */
public final class Digests {

    private Digests() {
    }

    public static String sha1Hex(String value) {
        return sha1Hex(value.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha1Hex(byte[] value) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(value));
        } catch (NoSuchAlgorithmException e) {
            // Every JDK ships SHA-1
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}

package com.glowup.backend.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Unsalted SHA-256 digests for deletion PINs. Stored hashes are compared as lowercase hex.
 */
public final class PinHasher {

    private static final String ALGORITHM = "SHA-256";

    private PinHasher() {}

    public static String hash(String pin) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            digest.update(pin.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }

    /**
     * An empty or missing PIN never matches a stored hash.
     */
    public static boolean matches(String pin, String storedHash) {
        if (pin == null || pin.isEmpty() || storedHash == null) {
            return false;
        }
        return hash(pin).equals(storedHash);
    }
}

package com.marketpool.infra;

import com.marketpool.error.ConfigurationException;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * 32-byte Fernet key in url-safe base64. The first half signs, the second half
 * encrypts.
 */
public final class FernetKey {

    private static final int KEY_LENGTH = 32;
    private static final int HALF = 16;

    private final byte[] signingKey;
    private final byte[] encryptionKey;

    private FernetKey(byte[] raw) {
        this.signingKey = Arrays.copyOfRange(raw, 0, HALF);
        this.encryptionKey = Arrays.copyOfRange(raw, HALF, KEY_LENGTH);
    }

    public static FernetKey parse(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new ConfigurationException("Encryption key is empty");
        }
        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Encryption key is not url-safe base64", e);
        }
        if (raw.length != KEY_LENGTH) {
            throw new ConfigurationException("Encryption key must decode to 32 bytes, got " + raw.length);
        }
        return new FernetKey(raw);
    }

    /**
     * Fresh random key, encoded the way {@link #parse(String)} expects.
     */
    public static String generate() {
        byte[] raw = new byte[KEY_LENGTH];
        new SecureRandom().nextBytes(raw);
        return Base64.getUrlEncoder().encodeToString(raw);
    }

    byte[] signingKey() {
        return signingKey.clone();
    }

    byte[] encryptionKey() {
        return encryptionKey.clone();
    }
}

package com.marketpool.domain;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;

/**
 * Content address of a text: lowercase hex SHA-256 of the trimmed UTF-8 bytes.
 */
public final class TextHasher {

    private TextHasher() {
    }

    public static String normalize(String text) {
        return text == null ? "" : text.strip();
    }

    public static String hash(String text) {
        byte[] digest = Hash.sha256(normalize(text).getBytes(StandardCharsets.UTF_8));
        return Numeric.toHexStringNoPrefix(digest);
    }
}

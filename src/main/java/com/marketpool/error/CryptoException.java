package com.marketpool.error;

/**
 * Ciphertext failed authentication or could not be decrypted. Never treated as plaintext.
 */
public class CryptoException extends MarketPoolException {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}

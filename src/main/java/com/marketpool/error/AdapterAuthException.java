package com.marketpool.error;

/**
 * Login handshake against a source failed. Fatal for that adapter only.
 */
public class AdapterAuthException extends MarketPoolException {

    public AdapterAuthException(String message) {
        super(message);
    }

    public AdapterAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}

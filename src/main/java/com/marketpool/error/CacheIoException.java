package com.marketpool.error;

/**
 * The local embedding cache artifact is missing, unreadable or malformed.
 */
public class CacheIoException extends MarketPoolException {

    public CacheIoException(String message) {
        super(message);
    }

    public CacheIoException(String message, Throwable cause) {
        super(message, cause);
    }
}

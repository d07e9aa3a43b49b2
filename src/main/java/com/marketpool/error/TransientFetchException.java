package com.marketpool.error;

/**
 * Network or HTTP failure while talking to a source or a remote artifact host.
 */
public class TransientFetchException extends MarketPoolException {

    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}

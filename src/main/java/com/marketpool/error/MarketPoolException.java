package com.marketpool.error;

/**
 * Root of the unchecked exception taxonomy. Subclasses tell callers whether a
 * failure may be isolated (adapter, page, record, cache) or must stop the run
 * (configuration, crypto).
 */
public class MarketPoolException extends RuntimeException {

    public MarketPoolException(String message) {
        super(message);
    }

    public MarketPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}

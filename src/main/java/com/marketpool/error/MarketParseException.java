package com.marketpool.error;

/**
 * A single platform record could not be parsed or converted.
 */
public class MarketParseException extends MarketPoolException {

    public MarketParseException(String message) {
        super(message);
    }

    public MarketParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

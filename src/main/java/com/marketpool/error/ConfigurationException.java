package com.marketpool.error;

/**
 * A required secret or credential is missing or malformed. Raised before any I/O.
 */
public class ConfigurationException extends MarketPoolException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ConfigurationException missing(String what, String envVar) {
        return new ConfigurationException(what + " is not configured (set " + envVar + ")");
    }
}

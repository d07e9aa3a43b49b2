package com.marketpool.error;

/**
 * The embedding provider answered with the wrong number or shape of vectors.
 */
public class ProviderContractException extends MarketPoolException {

    public ProviderContractException(String message) {
        super(message);
    }

    public ProviderContractException(String message, Throwable cause) {
        super(message, cause);
    }
}

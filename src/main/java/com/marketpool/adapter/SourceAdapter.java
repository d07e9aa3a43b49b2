package com.marketpool.adapter;

/**
 * One prediction-market platform. The orchestrator only ever sees this type.
 *
 * @param <M> the platform-native record type
 */
public interface SourceAdapter<M extends PlatformMarket> {

    String platformName();

    /**
     * Acquires whatever the platform needs (HTTP session, login). The returned
     * session must be closed on every exit path.
     *
     * @throws com.marketpool.error.AdapterAuthException   if login fails
     * @throws com.marketpool.error.ConfigurationException if the platform credential is missing
     */
    SourceSession<M> openSession();
}

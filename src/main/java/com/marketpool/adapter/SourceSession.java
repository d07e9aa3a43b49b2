package com.marketpool.adapter;

import com.marketpool.domain.MarketFilter;

import java.util.List;

public interface SourceSession<M extends PlatformMarket> extends AutoCloseable {

    /**
     * Runs the platform protocol and returns native records. Thresholds in the
     * filter are applied here when the source truncates early.
     *
     * @throws com.marketpool.error.TransientFetchException if not even the first page could be fetched
     */
    List<M> fetchMarkets(MarketFilter filter);

    @Override
    void close();
}

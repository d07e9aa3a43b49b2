package com.marketpool.adapter;

import com.marketpool.domain.PooledMarket;

/**
 * A record as one platform delivers it.
 */
public interface PlatformMarket {

    /**
     * Pure conversion, no I/O. Throws {@link com.marketpool.error.MarketParseException}
     * when this one record cannot be expressed canonically.
     */
    PooledMarket toPooledMarket();
}

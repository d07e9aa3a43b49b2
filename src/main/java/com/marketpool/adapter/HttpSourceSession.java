package com.marketpool.adapter;

import com.marketpool.infra.HttpSession;

/**
 * Base for sessions backed by one {@link HttpSession}, released on close.
 */
public abstract class HttpSourceSession<M extends PlatformMarket> implements SourceSession<M> {

    protected final HttpSession http;

    protected HttpSourceSession(HttpSession http) {
        this.http = http;
    }

    @Override
    public void close() {
        http.close();
    }
}

package com.marketpool.adapter;

import com.marketpool.error.MarketParseException;
import com.marketpool.error.TransientFetchException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Fetches one detail record per key, strictly one after another with a
 * cool-down in between. A key that fails or yields nothing is skipped.
 */
@Slf4j
public final class DetailFetcher {

    private DetailFetcher() {
    }

    public static <K, D> List<D> fetchEach(String platform, List<K> keys, Function<K, D> fetch, CoolDown coolDown) {
        List<D> out = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            K key = keys.get(i);
            try {
                D detail = fetch.apply(key);
                if (detail != null) {
                    out.add(detail);
                }
            } catch (TransientFetchException | MarketParseException e) {
                log.warn("[{}] Skipping {}: {}", platform, key, e.getMessage());
            }
            if (i < keys.size() - 1) {
                coolDown.pause();
            }
        }
        return out;
    }
}

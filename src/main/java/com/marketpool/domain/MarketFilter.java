package com.marketpool.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Thresholds handed to every adapter. Adapters whose source truncates results
 * early (sorted by a popularity metric) must apply them while paging.
 */
@Value
@Builder(toBuilder = true)
public class MarketFilter {

    @Builder.Default
    int minForecasters = 0;

    @Builder.Default
    int minComments = 0;

    @Builder.Default
    double minVolume = 0.0;

    @Builder.Default
    boolean onlyOpen = true;

    public static MarketFilter defaults() {
        return MarketFilter.builder().build();
    }
}

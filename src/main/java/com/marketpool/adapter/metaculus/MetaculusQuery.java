package com.marketpool.adapter.metaculus;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Server-side question filter.
 */
@Value
@Builder
public class MetaculusQuery {

    @Builder.Default
    String status = "open";

    @Builder.Default
    String forecastType = "binary";

    @Builder.Default
    int minForecasters = 40;

    @Builder.Default
    boolean withCommunityPrediction = true;

    LocalDate resolvesBefore; // null: no bound

    @Builder.Default
    int pageSize = 100;
}

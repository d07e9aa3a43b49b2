package com.marketpool.adapter.metaculus;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketpool.adapter.PlatformMarket;
import com.marketpool.domain.FlexibleTimestampParser;
import com.marketpool.domain.PooledMarket;
import com.marketpool.error.MarketParseException;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class MetaculusMarket implements PlatformMarket {

    static final String PLATFORM = "Metaculus";
    static final String BASE_URL = "https://www.metaculus.com";

    long id;
    String title;
    String publishedTime;
    int numForecasters;
    Double communityPrediction; // null when hidden or not yet computed

    static MetaculusMarket fromJson(JsonNode post) {
        if (!post.hasNonNull("id")) {
            throw new MarketParseException("Metaculus post without id");
        }
        JsonNode centers = post.path("question").path("aggregations")
                .path("recency_weighted").path("latest").path("centers");
        JsonNode center = centers.path(0);
        return MetaculusMarket.builder()
                .id(post.path("id").asLong())
                .title(post.path("title").asText(null))
                .publishedTime(post.path("published_at").asText(null))
                .numForecasters(post.path("nr_forecasters").asInt(0))
                .communityPrediction(center.isNumber() ? center.asDouble() : null)
                .build();
    }

    public String getPageUrl() {
        return BASE_URL + "/questions/" + id + "/";
    }

    @Override
    public PooledMarket toPooledMarket() {
        double yes = communityPrediction == null ? 0.5 : communityPrediction;
        return PooledMarket.builder()
                .id(PooledMarket.platformId("metaculus", id))
                .question(title)
                .outcomes(List.of("Yes", "No"))
                .outcomeProbabilities(List.of(yes, 1 - yes))
                .url(getPageUrl())
                .publishedAt(FlexibleTimestampParser.parse(publishedTime))
                .sourcePlatform(PLATFORM)
                .forecasterCount(numForecasters)
                .marketType("BINARY")
                .rawMarketData(this)
                .build();
    }
}

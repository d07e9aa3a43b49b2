package com.marketpool.adapter.manifold;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketpool.adapter.PlatformMarket;
import com.marketpool.domain.PooledMarket;
import com.marketpool.domain.PublishedAt;
import com.marketpool.error.MarketParseException;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder
public class ManifoldMarket implements PlatformMarket {

    static final String PLATFORM = "Manifold";
    static final String BINARY = "BINARY";
    static final String MULTIPLE_CHOICE = "MULTIPLE_CHOICE";

    String id;
    String question;
    String outcomeType;
    long createdTime; // epoch millis
    String creatorUsername;
    String slug;
    double volume;
    int uniqueBettorCount;
    String resolution;
    List<String> outcomes;
    List<Double> outcomePrices;

    static boolean isSupportedType(String outcomeType) {
        return BINARY.equals(outcomeType) || MULTIPLE_CHOICE.equals(outcomeType);
    }

    /**
     * Parses a full market as returned by the detail endpoint.
     */
    static ManifoldMarket fromJson(JsonNode data) {
        String id = data.path("id").asText("");
        String outcomeType = data.path("outcomeType").asText("");
        if (id.isEmpty() || !isSupportedType(outcomeType)) {
            throw new MarketParseException("Unsupported Manifold market " + id + " (" + outcomeType + ")");
        }
        if (!data.hasNonNull("createdTime")) {
            throw new MarketParseException("Manifold market " + id + " has no createdTime");
        }

        List<String> outcomes = new ArrayList<>();
        List<Double> prices = new ArrayList<>();
        if (BINARY.equals(outcomeType)) {
            JsonNode probability = data.path("probability");
            double p = probability.isNumber() ? probability.asDouble() : 0.5;
            outcomes.add("Yes");
            outcomes.add("No");
            prices.add(p);
            prices.add(1 - p);
        } else {
            for (JsonNode answer : data.path("answers")) {
                outcomes.add(answer.path("text").asText(""));
                prices.add(answer.path("probability").asDouble(0));
            }
        }

        JsonNode resolution = data.path("resolution");
        return ManifoldMarket.builder()
                .id(id)
                .question(data.path("question").asText(null))
                .outcomeType(outcomeType)
                .createdTime(data.path("createdTime").asLong())
                .creatorUsername(data.path("creatorUsername").asText(""))
                .slug(data.path("slug").asText(""))
                .volume(data.path("volume").asDouble(0))
                .uniqueBettorCount(data.path("uniqueBettorCount").asInt(0))
                .resolution(resolution.isTextual() ? resolution.asText() : null)
                .outcomes(outcomes)
                .outcomePrices(prices)
                .build();
    }

    /**
     * MKT resolves at market price and still counts as open.
     */
    public boolean isResolved() {
        return resolution != null && !resolution.isEmpty() && !"MKT".equals(resolution);
    }

    public String getUrl() {
        return "https://manifold.markets/" + creatorUsername + "/" + slug;
    }

    @Override
    public PooledMarket toPooledMarket() {
        return PooledMarket.builder()
                .id(PooledMarket.platformId("manifold", id))
                .question(question)
                .outcomes(outcomes)
                .outcomeProbabilities(outcomePrices)
                .url(getUrl())
                .publishedAt(PublishedAt.ofEpochMillis(createdTime))
                .sourcePlatform(PLATFORM)
                .volume(volume)
                .forecasterCount(uniqueBettorCount)
                .marketType(outcomeType)
                .resolved(isResolved())
                .rawMarketData(this)
                .build();
    }
}

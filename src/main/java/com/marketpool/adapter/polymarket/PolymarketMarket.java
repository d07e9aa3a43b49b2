package com.marketpool.adapter.polymarket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpool.adapter.PlatformMarket;
import com.marketpool.domain.FlexibleTimestampParser;
import com.marketpool.domain.PooledMarket;
import com.marketpool.error.MarketParseException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Slf4j
@Value
@Builder
public class PolymarketMarket implements PlatformMarket {

    static final String PLATFORM = "Polymarket";

    String id;
    String question;
    String slug;
    List<String> outcomes;
    List<Double> outcomePrices; // aligned with outcomes, entries may be null
    double volume;
    String createdAt;
    boolean active;
    boolean closed;
    String category;

    /**
     * Gamma sends {@code outcomes} and {@code outcomePrices} as JSON-encoded strings.
     */
    static PolymarketMarket fromJson(JsonNode node, ObjectMapper mapper) {
        String id = node.path("id").asText("");
        if (id.isEmpty()) {
            throw new MarketParseException("Polymarket market without id");
        }

        List<String> outcomes = new ArrayList<>();
        for (JsonNode outcome : embeddedArray(node.path("outcomes"), mapper)) {
            outcomes.add(outcome.asText());
        }

        // prices are cut or padded to the outcomes
        JsonNode rawPrices = embeddedArray(node.path("outcomePrices"), mapper);
        List<Double> prices = new ArrayList<>(outcomes.size());
        for (int i = 0; i < outcomes.size(); i++) {
            JsonNode price = rawPrices.path(i);
            prices.add(price.isMissingNode() || price.isNull() ? null : toDouble(price, 0.0));
        }

        double volume = toDouble(node.path("volume"), 0.0);
        if (volume == 0.0) {
            volume = toDouble(node.path("volumeNum"), 0.0);
        }

        return PolymarketMarket.builder()
                .id(id)
                .question(node.path("question").asText(null))
                .slug(node.path("slug").asText(""))
                .outcomes(outcomes)
                .outcomePrices(prices)
                .volume(volume)
                .createdAt(node.path("createdAt").asText(null))
                .active(node.path("active").asBoolean(false))
                .closed(node.path("closed").asBoolean(false))
                .category(node.path("category").asText(""))
                .build();
    }

    private static JsonNode embeddedArray(JsonNode field, ObjectMapper mapper) {
        if (field.isArray()) {
            return field;
        }
        String text = field.asText("");
        if (text.isEmpty() || "null".equals(text)) {
            return mapper.createArrayNode();
        }
        try {
            JsonNode parsed = mapper.readTree(text);
            return parsed.isArray() ? parsed : mapper.createArrayNode();
        } catch (IOException e) {
            log.debug("Unparseable embedded array {}: {}", text, e.getMessage());
            return mapper.createArrayNode();
        }
    }

    private static double toDouble(JsonNode value, double fallback) {
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return value.isTextual() ? Double.parseDouble(value.asText()) : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public String getUrl() {
        return slug.isEmpty() ? "" : "https://polymarket.com/event/" + slug;
    }

    String marketType() {
        if (!category.isEmpty()) {
            return category;
        }
        if (outcomes.size() == 2) {
            List<String> lower = new ArrayList<>();
            outcomes.forEach(o -> lower.add(o.toLowerCase(Locale.ROOT)));
            boolean yesNo = lower.contains("yes") && lower.contains("no");
            boolean trueFalse = lower.contains("true") && lower.contains("false");
            return yesNo || trueFalse ? "BINARY" : "CATEGORICAL";
        }
        return outcomes.size() > 2 ? "CATEGORICAL" : "UNKNOWN";
    }

    @Override
    public PooledMarket toPooledMarket() {
        return PooledMarket.builder()
                .id(PooledMarket.platformId("polymarket", id))
                .question(question)
                .outcomes(outcomes)
                .outcomeProbabilities(outcomePrices)
                .url(getUrl())
                .publishedAt(FlexibleTimestampParser.parse(createdAt))
                .sourcePlatform(PLATFORM)
                .volume(volume)
                .marketType(marketType())
                .resolved(closed)
                .rawMarketData(this)
                .build();
    }
}

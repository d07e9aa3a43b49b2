package com.marketpool.domain;

import com.marketpool.error.MarketParseException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Canonical market record every adapter produces.
 * <p>
 * {@code formattedOutcomes} is always derived from outcomes and probabilities in
 * the constructor, so there is no builder property for it. The raw platform
 * object is kept for tracing only and takes no part in equality.
 */
@Value
public class PooledMarket {

    String id; // platform-prefixed, e.g. "gjopen_123"
    String question;
    List<String> outcomes;
    List<Double> outcomeProbabilities; // entries may be null
    String formattedOutcomes;
    String url;
    PublishedAt publishedAt;
    String sourcePlatform;

    Double volume;
    Integer forecasterCount;
    Integer commentCount;
    String marketType;
    Boolean resolved;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Object rawMarketData;

    @Builder(toBuilder = true)
    private PooledMarket(String id, String question, List<String> outcomes, List<Double> outcomeProbabilities,
            String url, PublishedAt publishedAt, String sourcePlatform, Double volume, Integer forecasterCount,
            Integer commentCount, String marketType, Boolean resolved, Object rawMarketData) {
        if (isBlank(id)) {
            throw new MarketParseException("Market id is required");
        }
        if (isBlank(question)) {
            throw new MarketParseException("Market " + id + " has no question text");
        }
        if (isBlank(sourcePlatform)) {
            throw new MarketParseException("Market " + id + " has no source platform");
        }
        List<String> labels = outcomes == null ? List.of() : List.copyOf(outcomes);
        List<Double> probabilities = alignProbabilities(id, labels, outcomeProbabilities);

        this.id = id;
        this.question = question;
        this.outcomes = labels;
        this.outcomeProbabilities = probabilities;
        this.formattedOutcomes = OutcomeFormatter.format(labels, probabilities);
        this.url = url;
        this.publishedAt = publishedAt;
        this.sourcePlatform = sourcePlatform;
        this.volume = volume;
        this.forecasterCount = forecasterCount;
        this.commentCount = commentCount;
        this.marketType = marketType;
        this.resolved = resolved;
        this.rawMarketData = rawMarketData;
    }

    public static String platformId(String prefix, Object nativeId) {
        return prefix + "_" + nativeId;
    }

    public PooledMarket withPublishedAt(PublishedAt value) {
        return toBuilder().publishedAt(value).build();
    }

    public PooledMarket withOutcomes(List<String> labels, List<Double> probabilities) {
        return toBuilder().outcomes(labels).outcomeProbabilities(probabilities).build();
    }

    /**
     * Copy without the platform back-reference, as persisted.
     */
    public PooledMarket withoutRawData() {
        return rawMarketData == null ? this : toBuilder().rawMarketData(null).build();
    }

    private static List<Double> alignProbabilities(String id, List<String> labels, List<Double> probabilities) {
        List<Double> out = new ArrayList<>(labels.size());
        if (probabilities == null) {
            for (int i = 0; i < labels.size(); i++) {
                out.add(null);
            }
        } else if (probabilities.size() != labels.size()) {
            throw new MarketParseException("Market " + id + " has " + labels.size() + " outcomes but "
                    + probabilities.size() + " probabilities");
        } else {
            out.addAll(probabilities);
        }
        return Collections.unmodifiableList(out);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

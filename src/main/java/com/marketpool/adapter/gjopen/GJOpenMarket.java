package com.marketpool.adapter.gjopen;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketpool.adapter.PlatformMarket;
import com.marketpool.domain.FlexibleTimestampParser;
import com.marketpool.domain.PooledMarket;
import com.marketpool.error.MarketParseException;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder
public class GJOpenMarket implements PlatformMarket {

    static final String PLATFORM = "GJOpen";

    String id;
    String name;
    String publishedAt;
    int predictorsCount;
    int commentsCount;
    String description;
    boolean binary;
    boolean continuousScored;
    String type;
    List<Answer> answers;
    String url;

    @Value
    public static class Answer {
        String name;
        Double probability;
    }

    /**
     * Reads the {@code question} object embedded in a question page's react props.
     */
    static GJOpenMarket fromJson(JsonNode question, String url) {
        String id = question.path("id").asText("");
        if (id.isEmpty()) {
            throw new MarketParseException("GJOpen question without id at " + url);
        }
        List<Answer> answers = new ArrayList<>();
        for (JsonNode answer : question.path("answers")) {
            JsonNode probability = answer.path("probability");
            answers.add(new Answer(answer.path("name").asText(""),
                    probability.isNumber() ? probability.asDouble() : null));
        }
        return GJOpenMarket.builder()
                .id(id)
                .name(question.path("name").asText(null))
                .publishedAt(question.path("published_at").asText(null))
                .predictorsCount(question.path("predictors_count").asInt(0))
                .commentsCount(question.path("comments_count").asInt(0))
                .description(question.path("description").asText(null))
                .binary(question.path("binary?").asBoolean(false))
                .continuousScored(question.path("continuous_scored?").asBoolean(false))
                .type(question.path("type").asText(null))
                .answers(answers)
                .url(url)
                .build();
    }

    @Override
    public PooledMarket toPooledMarket() {
        List<String> labels = new ArrayList<>(answers.size());
        List<Double> probabilities = new ArrayList<>(answers.size());
        for (Answer answer : answers) {
            labels.add(answer.getName());
            probabilities.add(answer.getProbability());
        }
        return PooledMarket.builder()
                .id(PooledMarket.platformId("gjopen", id))
                .question(name)
                .outcomes(labels)
                .outcomeProbabilities(probabilities)
                .url(url)
                .publishedAt(FlexibleTimestampParser.parse(publishedAt))
                .sourcePlatform(PLATFORM)
                .forecasterCount(predictorsCount)
                .commentCount(commentsCount)
                .marketType(type)
                .rawMarketData(this)
                .build();
    }
}

package com.marketpool.adapter.metaculus;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketpool.error.MarketParseException;
import com.marketpool.infra.HttpSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
public class MetaculusRestApi implements MetaculusApi {

    static final String POSTS_URL = "https://www.metaculus.com/api/posts/";

    private final HttpSession http;

    @Override
    public QuestionPage fetchQuestions(MetaculusQuery query, int offset) {
        JsonNode response = http.getJson(url(query, offset));
        List<MetaculusMarket> questions = new ArrayList<>();
        for (JsonNode post : response.path("results")) {
            try {
                questions.add(MetaculusMarket.fromJson(post));
            } catch (MarketParseException e) {
                log.warn("[{}] Skipping record: {}", MetaculusMarket.PLATFORM, e.getMessage());
            }
        }
        boolean hasMore = response.hasNonNull("next") && !response.path("results").isEmpty();
        return new QuestionPage(questions, hasMore);
    }

    static String url(MetaculusQuery query, int offset) {
        StringBuilder url = new StringBuilder(POSTS_URL)
                .append("?limit=").append(query.getPageSize())
                .append("&offset=").append(offset)
                .append("&statuses=").append(query.getStatus())
                .append("&forecast_type=").append(query.getForecastType())
                .append("&forecaster_count__gte=").append(query.getMinForecasters())
                .append("&order_by=-published_at");
        if (query.isWithCommunityPrediction()) {
            url.append("&with_cp=true");
        }
        if (query.getResolvesBefore() != null) {
            url.append("&scheduled_resolve_time__lt=").append(query.getResolvesBefore());
        }
        return url.toString();
    }
}

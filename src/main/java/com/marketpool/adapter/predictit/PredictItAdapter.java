package com.marketpool.adapter.predictit;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketpool.adapter.HttpSourceSession;
import com.marketpool.adapter.SourceAdapter;
import com.marketpool.adapter.SourceSession;
import com.marketpool.domain.MarketFilter;
import com.marketpool.error.MarketParseException;
import com.marketpool.infra.HttpSession;
import com.marketpool.infra.HttpSessionFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * PredictIt publishes every market in one snapshot document.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PredictItAdapter implements SourceAdapter<PredictItMarket> {

    static final String API_URL = "https://www.predictit.org/api/marketdata/all/";

    private final HttpSessionFactory sessions;

    @Override
    public String platformName() {
        return PredictItMarket.PLATFORM;
    }

    @Override
    public SourceSession<PredictItMarket> openSession() {
        return new Session(sessions.open());
    }

    private static class Session extends HttpSourceSession<PredictItMarket> {

        Session(HttpSession http) {
            super(http);
        }

        @Override
        public List<PredictItMarket> fetchMarkets(MarketFilter filter) {
            JsonNode snapshot = http.getJson(API_URL);
            List<PredictItMarket> markets = new ArrayList<>();
            for (JsonNode node : snapshot.path("markets")) {
                try {
                    PredictItMarket market = PredictItMarket.fromJson(node);
                    if (!(filter.isOnlyOpen() && market.isClosed())) {
                        markets.add(market);
                    }
                } catch (MarketParseException e) {
                    log.warn("[{}] Skipping record: {}", PredictItMarket.PLATFORM, e.getMessage());
                }
            }
            log.info("[{}] Snapshot holds {} markets", PredictItMarket.PLATFORM, markets.size());
            return markets;
        }
    }
}

package com.marketpool.adapter.polymarket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpool.adapter.CoolDown;
import com.marketpool.adapter.HttpSourceSession;
import com.marketpool.adapter.PageWalker;
import com.marketpool.adapter.SourceAdapter;
import com.marketpool.adapter.SourceSession;
import com.marketpool.domain.MarketFilter;
import com.marketpool.error.MarketParseException;
import com.marketpool.infra.HttpSession;
import com.marketpool.infra.HttpSessionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Polymarket Gamma API, offset paging with full records on every page.
 */
@Slf4j
@Component
public class PolymarketGammaAdapter implements SourceAdapter<PolymarketMarket> {

    static final String MARKETS_URL = "https://gamma-api.polymarket.com/markets";
    static final int PAGE_LIMIT = 500;
    static final double DEFAULT_MIN_VOLUME = 10_000;

    private final HttpSessionFactory sessions;
    private final ObjectMapper objectMapper;
    private final int maxPages;
    private final CoolDown pageCoolDown;

    @Autowired
    public PolymarketGammaAdapter(HttpSessionFactory sessions, ObjectMapper objectMapper) {
        this(sessions, objectMapper, 200, CoolDown.ofMillis(100));
    }

    PolymarketGammaAdapter(HttpSessionFactory sessions, ObjectMapper objectMapper, int maxPages,
            CoolDown pageCoolDown) {
        this.sessions = sessions;
        this.objectMapper = objectMapper;
        this.maxPages = maxPages;
        this.pageCoolDown = pageCoolDown;
    }

    @Override
    public String platformName() {
        return PolymarketMarket.PLATFORM;
    }

    @Override
    public SourceSession<PolymarketMarket> openSession() {
        return new Session(sessions.open());
    }

    static String pageUrl(int offset) {
        return MARKETS_URL + "?limit=" + PAGE_LIMIT + "&offset=" + offset;
    }

    private class Session extends HttpSourceSession<PolymarketMarket> {

        Session(HttpSession http) {
            super(http);
        }

        @Override
        public List<PolymarketMarket> fetchMarkets(MarketFilter filter) {
            double minVolume = Math.max(filter.getMinVolume(), DEFAULT_MIN_VOLUME);

            List<PolymarketMarket> markets = PageWalker.<PolymarketMarket>builder()
                    .platform(PolymarketMarket.PLATFORM)
                    .maxPages(maxPages)
                    .pageSize(PAGE_LIMIT)
                    .pageCoolDown(pageCoolDown)
                    .identity(PolymarketMarket::getId)
                    .build()
                    .walk((page, previous) -> parsePage(http.getJson(pageUrl((page - 1) * PAGE_LIMIT))));

            return markets.stream()
                    .filter(m -> !(filter.isOnlyOpen() && m.isClosed()))
                    .filter(m -> m.getVolume() >= minVolume)
                    .collect(Collectors.toList());
        }

        private List<PolymarketMarket> parsePage(JsonNode page) {
            List<PolymarketMarket> out = new ArrayList<>();
            if (page == null || !page.isArray()) {
                return out;
            }
            for (JsonNode node : page) {
                try {
                    out.add(PolymarketMarket.fromJson(node, objectMapper));
                } catch (MarketParseException e) {
                    log.warn("[{}] Skipping record: {}", PolymarketMarket.PLATFORM, e.getMessage());
                }
            }
            return out;
        }
    }
}

package com.marketpool.adapter.manifold;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketpool.adapter.CoolDown;
import com.marketpool.adapter.DetailFetcher;
import com.marketpool.adapter.HttpSourceSession;
import com.marketpool.adapter.PageWalker;
import com.marketpool.adapter.SourceAdapter;
import com.marketpool.adapter.SourceSession;
import com.marketpool.domain.MarketFilter;
import com.marketpool.infra.HttpSession;
import com.marketpool.infra.HttpSessionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Manifold REST API: summaries paged newest first with a {@code before} cursor,
 * then one detail call per market that passes the summary filter.
 */
@Slf4j
@Component
public class ManifoldAdapter implements SourceAdapter<ManifoldMarket> {

    static final String MARKETS_URL = "https://api.manifold.markets/v0/markets";
    static final String MARKET_URL = "https://api.manifold.markets/v0/market/";
    static final int PAGE_LIMIT = 1000;
    static final int DEFAULT_MIN_BETTORS = 50;

    private final HttpSessionFactory sessions;
    private final String apiKey;
    private final int maxPages;
    private final CoolDown pageCoolDown;
    private final CoolDown itemCoolDown;

    @Autowired
    public ManifoldAdapter(HttpSessionFactory sessions, @Value("${marketpool.manifold.api-key:}") String apiKey) {
        this(sessions, apiKey, 50, CoolDown.ofMillis(200), CoolDown.ofMillis(100));
    }

    ManifoldAdapter(HttpSessionFactory sessions, String apiKey, int maxPages, CoolDown pageCoolDown,
            CoolDown itemCoolDown) {
        this.sessions = sessions;
        this.apiKey = apiKey;
        this.maxPages = maxPages;
        this.pageCoolDown = pageCoolDown;
        this.itemCoolDown = itemCoolDown;
    }

    @Override
    public String platformName() {
        return ManifoldMarket.PLATFORM;
    }

    @Override
    public SourceSession<ManifoldMarket> openSession() {
        Map<String, String> headers = apiKey == null || apiKey.isBlank()
                ? Map.of()
                : Map.of("Authorization", "Key " + apiKey);
        return new Session(sessions.open(headers));
    }

    static String listUrl(String before) {
        String url = MARKETS_URL + "?limit=" + PAGE_LIMIT + "&sort=created-time&order=desc";
        return before == null ? url : url + "&before=" + before;
    }

    private class Session extends HttpSourceSession<ManifoldMarket> {

        Session(HttpSession http) {
            super(http);
        }

        @Override
        public List<ManifoldMarket> fetchMarkets(MarketFilter filter) {
            int minBettors = Math.max(filter.getMinForecasters(), DEFAULT_MIN_BETTORS);
            double minVolume = filter.getMinVolume();

            // sorted by creation time, so no participation floor while paging
            List<JsonNode> summaries = PageWalker.<JsonNode>builder()
                    .platform(ManifoldMarket.PLATFORM)
                    .maxPages(maxPages)
                    .pageSize(PAGE_LIMIT)
                    .pageCoolDown(pageCoolDown)
                    .identity(node -> node.path("id").asText())
                    .build()
                    .walk((page, previous) -> {
                        String before = previous.isEmpty()
                                ? null
                                : previous.get(previous.size() - 1).path("id").asText();
                        List<JsonNode> items = new ArrayList<>();
                        http.getJson(listUrl(before)).forEach(items::add);
                        return items;
                    });

            List<String> candidates = summaries.stream()
                    .filter(s -> !(filter.isOnlyOpen() && s.path("isResolved").asBoolean(false)))
                    .filter(s -> s.path("uniqueBettorCount").asInt(0) >= minBettors)
                    .filter(s -> s.path("volume").asDouble(0) >= minVolume)
                    .filter(s -> ManifoldMarket.isSupportedType(s.path("outcomeType").asText()))
                    .map(s -> s.path("id").asText())
                    .collect(Collectors.toList());
            log.info("[{}] {} of {} summaries pass the filter", ManifoldMarket.PLATFORM, candidates.size(),
                    summaries.size());

            return DetailFetcher.fetchEach(ManifoldMarket.PLATFORM, candidates,
                    id -> ManifoldMarket.fromJson(http.getJson(MARKET_URL + id)), itemCoolDown)
                    .stream()
                    .filter(m -> !(filter.isOnlyOpen() && m.isResolved()))
                    .filter(m -> m.getUniqueBettorCount() >= minBettors && m.getVolume() >= minVolume)
                    .collect(Collectors.toList());
        }
    }
}

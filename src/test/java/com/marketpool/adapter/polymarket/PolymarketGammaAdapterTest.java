package com.marketpool.adapter.polymarket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.marketpool.adapter.CoolDown;
import com.marketpool.adapter.SourceSession;
import com.marketpool.domain.MarketFilter;
import com.marketpool.domain.PooledMarket;
import com.marketpool.error.TransientFetchException;
import com.marketpool.infra.HttpSession;
import com.marketpool.infra.HttpSessionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PolymarketGammaAdapterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private HttpSessionFactory factory;
    private HttpSession http;

    @BeforeEach
    void setUp() {
        factory = mock(HttpSessionFactory.class);
        http = mock(HttpSession.class);
        when(factory.open()).thenReturn(http);
    }

    private ObjectNode market(String id, String outcomes, String prices, String volume, boolean closed) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", id);
        node.put("question", "Market " + id + "?");
        node.put("slug", "market-" + id);
        node.put("outcomes", outcomes);
        node.put("outcomePrices", prices);
        node.put("volume", volume);
        node.put("createdAt", "2024-02-01T08:00:00.123456Z");
        node.put("closed", closed);
        return node;
    }

    private ArrayNode fullPage(int offset) {
        ArrayNode page = mapper.createArrayNode();
        for (int i = 0; i < PolymarketGammaAdapter.PAGE_LIMIT; i++) {
            page.add(market("p" + (offset + i), "[\"Yes\",\"No\"]", "[\"0.5\",\"0.5\"]", "20000", false));
        }
        return page;
    }

    private PolymarketGammaAdapter adapter() {
        return new PolymarketGammaAdapter(factory, mapper, 200, CoolDown.NONE);
    }

    @Test
    void testOffsetPagingStopsOnShortPage() {
        ArrayNode lastPage = mapper.createArrayNode();
        lastPage.add(market("last", "[\"Yes\",\"No\"]", "[\"0.1\",\"0.9\"]", "50000", false));
        lastPage.add(market("small", "[\"Yes\",\"No\"]", "[\"0.1\",\"0.9\"]", "10", false));
        lastPage.add(market("done", "[\"Yes\",\"No\"]", "[\"1\",\"0\"]", "50000", true));
        when(http.getJson(PolymarketGammaAdapter.pageUrl(0))).thenReturn(fullPage(0));
        when(http.getJson(PolymarketGammaAdapter.pageUrl(500))).thenReturn(lastPage);

        List<PolymarketMarket> markets;
        try (SourceSession<PolymarketMarket> session = adapter().openSession()) {
            markets = session.fetchMarkets(MarketFilter.defaults());
        }

        assertEquals(PolymarketGammaAdapter.PAGE_LIMIT + 1, markets.size());
        assertTrue(markets.stream().anyMatch(m -> m.getId().equals("last")));
        verify(http, never()).getJson(PolymarketGammaAdapter.pageUrl(1000));
        verify(http).close();
    }

    @Test
    void testUnreachableLaterPageEndsPagination() {
        when(http.getJson(PolymarketGammaAdapter.pageUrl(0))).thenReturn(fullPage(0));
        when(http.getJson(PolymarketGammaAdapter.pageUrl(500))).thenThrow(new TransientFetchException("timeout"));

        try (SourceSession<PolymarketMarket> session = adapter().openSession()) {
            assertEquals(PolymarketGammaAdapter.PAGE_LIMIT, session.fetchMarkets(MarketFilter.defaults()).size());
        }
    }

    @Test
    void testEmbeddedJsonStringsAndPadding() {
        JsonNode node = market("7", "[\"A\",\"B\",\"C\"]", "[\"0.2\",\"0.3\"]", "0", false)
                .put("volumeNum", 1234.5);

        PolymarketMarket market = PolymarketMarket.fromJson(node, mapper);
        PooledMarket pooled = market.toPooledMarket();

        assertEquals(Arrays.asList(0.2, 0.3, null), pooled.getOutcomeProbabilities());
        assertEquals("A: 20.0%; B: 30.0%; C: N/A", pooled.getFormattedOutcomes());
        assertEquals(1234.5, pooled.getVolume());
        assertEquals("CATEGORICAL", pooled.getMarketType());
        assertEquals("https://polymarket.com/event/market-7", pooled.getUrl());
        assertEquals("polymarket_7", pooled.getId());
    }

    @Test
    void testPricesTruncatedToOutcomesAndGarbageTolerated() {
        PolymarketMarket extra = PolymarketMarket.fromJson(
                market("1", "[\"Yes\",\"No\"]", "[\"0.6\",\"0.4\",\"0.9\"]", "1", true), mapper);
        PolymarketMarket garbage = PolymarketMarket.fromJson(
                market("2", "[\"True\",\"False\"]", "not json", "1", false), mapper);

        assertEquals(List.of(0.6, 0.4), extra.getOutcomePrices());
        assertEquals("BINARY", extra.marketType());
        assertEquals(Boolean.TRUE, extra.toPooledMarket().getResolved());
        assertEquals(Arrays.asList(null, null), garbage.getOutcomePrices());
        assertEquals("BINARY", garbage.marketType());
    }

    @Test
    void testCategoryWinsOverInference() {
        ObjectNode node = market("3", "[\"Yes\",\"No\"]", "[\"0.5\",\"0.5\"]", "1", false);
        node.put("category", "Sports");

        assertEquals("Sports", PolymarketMarket.fromJson(node, mapper).toPooledMarket().getMarketType());
    }
}

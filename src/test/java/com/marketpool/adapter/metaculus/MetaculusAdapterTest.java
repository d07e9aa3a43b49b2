package com.marketpool.adapter.metaculus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpool.adapter.CoolDown;
import com.marketpool.adapter.SourceSession;
import com.marketpool.domain.MarketFilter;
import com.marketpool.domain.PooledMarket;
import com.marketpool.error.TransientFetchException;
import com.marketpool.infra.HttpSession;
import com.marketpool.infra.HttpSessionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MetaculusAdapterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    private HttpSessionFactory factory;
    private HttpSession http;
    private MetaculusApi api;

    @BeforeEach
    void setUp() {
        factory = mock(HttpSessionFactory.class);
        http = mock(HttpSession.class);
        api = mock(MetaculusApi.class);
        when(factory.open(anyMap())).thenReturn(http);
    }

    private MetaculusAdapter adapter() {
        return new MetaculusAdapter(factory, "", session -> api, CLOCK, 50, CoolDown.NONE);
    }

    private static MetaculusMarket question(long id, Double cp) {
        return MetaculusMarket.builder().id(id).title("Question " + id + "?").numForecasters(120)
                .publishedTime("2024-05-01T00:00:00Z").communityPrediction(cp).build();
    }

    @Test
    void testOffsetPagingWithServerSideFilter() {
        when(api.fetchQuestions(any(), eq(0)))
                .thenReturn(new MetaculusApi.QuestionPage(List.of(question(1, 0.7), question(2, null)), true));
        when(api.fetchQuestions(any(), eq(100)))
                .thenReturn(new MetaculusApi.QuestionPage(List.of(question(3, 0.1)), false));

        List<MetaculusMarket> markets;
        try (SourceSession<MetaculusMarket> session = adapter().openSession()) {
            markets = session.fetchMarkets(MarketFilter.defaults());
        }

        assertEquals(3, markets.size());
        ArgumentCaptor<MetaculusQuery> query = ArgumentCaptor.forClass(MetaculusQuery.class);
        verify(api, times(2)).fetchQuestions(query.capture(), anyInt());
        assertEquals("open", query.getValue().getStatus());
        assertEquals("binary", query.getValue().getForecastType());
        assertEquals(40, query.getValue().getMinForecasters());
        assertTrue(query.getValue().isWithCommunityPrediction());
        assertEquals(LocalDate.of(2025, 6, 1), query.getValue().getResolvesBefore());
        verify(http).close();
    }

    @Test
    void testFirstPageFailurePropagatesLaterPageDoesNot() {
        when(api.fetchQuestions(any(), eq(0))).thenThrow(new TransientFetchException("down"));
        try (SourceSession<MetaculusMarket> session = adapter().openSession()) {
            assertThrows(TransientFetchException.class, () -> session.fetchMarkets(MarketFilter.defaults()));
        }

        reset(api);
        when(api.fetchQuestions(any(), eq(0)))
                .thenReturn(new MetaculusApi.QuestionPage(List.of(question(1, 0.7)), true));
        when(api.fetchQuestions(any(), eq(100))).thenThrow(new TransientFetchException("down"));
        try (SourceSession<MetaculusMarket> session = adapter().openSession()) {
            assertEquals(1, session.fetchMarkets(MarketFilter.defaults()).size());
        }
    }

    @Test
    void testTokenHeader() {
        new MetaculusAdapter(factory, "abc", session -> api, CLOCK, 1, CoolDown.NONE).openSession().close();

        verify(factory).open(Map.of("Authorization", "Token abc"));
    }

    @Test
    void testSessionReleasedWhenClientCannotBeBuilt() {
        MetaculusAdapter adapter = new MetaculusAdapter(factory, "", session -> {
            throw new IllegalStateException("bad client config");
        }, CLOCK, 1, CoolDown.NONE);

        assertThrows(IllegalStateException.class, adapter::openSession);
        verify(http).close();
    }

    @Test
    void testConversionDefaultsToEvenOdds() {
        PooledMarket known = question(5, 0.8).toPooledMarket();
        PooledMarket unknown = question(6, null).toPooledMarket();

        assertEquals("metaculus_5", known.getId());
        assertEquals(List.of("Yes", "No"), known.getOutcomes());
        assertEquals(0.8, known.getOutcomeProbabilities().get(0), 1e-9);
        assertEquals(0.2, known.getOutcomeProbabilities().get(1), 1e-9);
        assertEquals("https://www.metaculus.com/questions/5/", known.getUrl());
        assertEquals("BINARY", known.getMarketType());
        assertEquals(List.of(0.5, 0.5), unknown.getOutcomeProbabilities());
    }

    @Test
    void testRestClientParsesPosts() throws Exception {
        String body = "{\"next\":\"https://www.metaculus.com/api/posts/?offset=100\",\"results\":["
                + "{\"id\":42,\"title\":\"Will it?\",\"published_at\":\"2024-01-01T00:00:00Z\",\"nr_forecasters\":77,"
                + "\"question\":{\"aggregations\":{\"recency_weighted\":{\"latest\":{\"centers\":[0.33]}}}}},"
                + "{\"title\":\"broken\"}]}";
        MetaculusQuery query = MetaculusQuery.builder().resolvesBefore(LocalDate.of(2025, 1, 1)).build();
        when(http.getJson(MetaculusRestApi.url(query, 0))).thenReturn(new ObjectMapper().readTree(body));

        MetaculusApi.QuestionPage page = new MetaculusRestApi(http).fetchQuestions(query, 0);

        assertTrue(page.isHasMore());
        assertEquals(1, page.getQuestions().size());
        assertEquals(0.33, page.getQuestions().get(0).getCommunityPrediction(), 1e-9);
        assertEquals(77, page.getQuestions().get(0).getNumForecasters());
        assertTrue(MetaculusRestApi.url(query, 0).contains("scheduled_resolve_time__lt=2025-01-01"));
    }
}

package com.marketpool.core;

import com.marketpool.adapter.PlatformMarket;
import com.marketpool.adapter.SourceAdapter;
import com.marketpool.adapter.SourceSession;
import com.marketpool.domain.MarketFilter;
import com.marketpool.domain.PooledMarket;
import com.marketpool.domain.PublishedAt;
import com.marketpool.error.AdapterAuthException;
import com.marketpool.error.MarketParseException;
import com.marketpool.error.TransientFetchException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FetchOrchestratorTest {

    private interface Fetch {
        List<PlatformMarket> apply(MarketFilter filter);
    }

    /**
     * Test double for a platform: hands out sessions backed by a fixed fetch function.
     */
    private static class FakeAdapter implements SourceAdapter<PlatformMarket> {
        private final String name;
        private final Fetch fetch;
        private final RuntimeException openFailure;
        RuntimeException closeFailure;
        final AtomicInteger closed = new AtomicInteger();

        FakeAdapter(String name, Fetch fetch) {
            this(name, fetch, null);
        }

        FakeAdapter(String name, Fetch fetch, RuntimeException openFailure) {
            this.name = name;
            this.fetch = fetch;
            this.openFailure = openFailure;
        }

        @Override
        public String platformName() {
            return name;
        }

        @Override
        public SourceSession<PlatformMarket> openSession() {
            if (openFailure != null) {
                throw openFailure;
            }
            return new SourceSession<PlatformMarket>() {
                @Override
                public List<PlatformMarket> fetchMarkets(MarketFilter filter) {
                    return fetch.apply(filter);
                }

                @Override
                public void close() {
                    closed.incrementAndGet();
                    if (closeFailure != null) {
                        throw closeFailure;
                    }
                }
            };
        }
    }

    private static PlatformMarket record(String platform, String id, String question, PublishedAt publishedAt) {
        return () -> PooledMarket.builder()
                .id(platform.toLowerCase() + "_" + id)
                .question(question)
                .outcomes(List.of("Yes", "No"))
                .outcomeProbabilities(List.of(0.6, 0.4))
                .sourcePlatform(platform)
                .publishedAt(publishedAt)
                .build();
    }

    private static PublishedAt utc(int day) {
        return PublishedAt.of(OffsetDateTime.of(2024, 1, day, 12, 0, 0, 0, ZoneOffset.UTC));
    }

    private static List<String> questions(List<PooledMarket> markets) {
        return markets.stream().map(PooledMarket::getQuestion).collect(Collectors.toList());
    }

    private static FetchOrchestrator orchestrator(SourceAdapter<?>... adapters) {
        return new FetchOrchestrator(Arrays.asList(adapters));
    }

    @Test
    void testDuplicateQuestionsCollapseAcrossSources() {
        FakeAdapter first = new FakeAdapter("A", f -> List.of(
                record("A", "1", "Will it rain?", utc(2)),
                record("A", "2", "Will it snow?", utc(1))));
        FakeAdapter second = new FakeAdapter("B", f -> List.of(
                record("B", "9", "Will it rain?", utc(3))));

        List<PooledMarket> result = orchestrator(first, second).fetchAll(MarketFilter.defaults());

        assertEquals(2, result.size());
        assertEquals(Set.of("Will it rain?", "Will it snow?"), Set.copyOf(questions(result)));
        assertEquals(1, first.closed.get());
        assertEquals(1, second.closed.get());
    }

    @Test
    void testFailingSourcesContributeNothing() {
        FakeAdapter healthy = new FakeAdapter("Healthy", f -> List.of(record("Healthy", "1", "Q1?", utc(1))));
        FakeAdapter badLogin = new FakeAdapter("BadLogin", f -> List.of(),
                new AdapterAuthException("rejected"));
        FakeAdapter down = new FakeAdapter("Down", f -> {
            throw new TransientFetchException("503");
        });

        List<PooledMarket> result = orchestrator(healthy, badLogin, down).fetchAll(MarketFilter.defaults());

        assertEquals(List.of("Q1?"), questions(result));
        assertEquals(1, down.closed.get());
    }

    @Test
    void testRecordsKeptWhenSessionReleaseFails() {
        FakeAdapter leaky = new FakeAdapter("Leaky", f -> List.of(record("Leaky", "1", "Still here?", utc(1))));
        leaky.closeFailure = new IllegalStateException("connection pool already shut down");

        List<PooledMarket> result = orchestrator(leaky).fetchAll(MarketFilter.defaults());

        assertEquals(List.of("Still here?"), questions(result));
        assertEquals(1, leaky.closed.get());
    }

    @Test
    void testAllSourcesFailingYieldsEmptyResult() {
        FakeAdapter down = new FakeAdapter("Down", f -> {
            throw new TransientFetchException("503");
        });
        FakeAdapter broken = new FakeAdapter("Broken", f -> {
            throw new IllegalStateException("bug");
        });

        assertTrue(orchestrator(down, broken).fetchAll(MarketFilter.defaults()).isEmpty());
        assertTrue(orchestrator().fetchAll(MarketFilter.defaults()).isEmpty());
    }

    @Test
    void testRecordThatFailsConversionIsSkipped() {
        PlatformMarket broken = () -> {
            throw new MarketParseException("no question");
        };
        FakeAdapter source = new FakeAdapter("A", f -> List.of(broken, record("A", "2", "Kept?", utc(1))));

        assertEquals(List.of("Kept?"), questions(orchestrator(source).fetchAll(MarketFilter.defaults())));
    }

    @Test
    void testSourcesRunConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        Fetch waitForPeer = f -> {
            bothStarted.countDown();
            try {
                if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                    throw new TransientFetchException("peer never started");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientFetchException("interrupted");
            }
            return List.of(record("X", String.valueOf(Thread.currentThread().getId()),
                    "From " + Thread.currentThread().getName(), utc(1)));
        };

        List<PooledMarket> result = orchestrator(new FakeAdapter("A", waitForPeer), new FakeAdapter("B", waitForPeer))
                .fetchAll(MarketFilter.defaults());

        assertEquals(2, result.size());
    }

    @Test
    void testFilterReachesEverySource() {
        List<MarketFilter> seen = new ArrayList<>();
        MarketFilter filter = MarketFilter.builder().minForecasters(100).onlyOpen(false).build();
        FakeAdapter source = new FakeAdapter("A", f -> {
            synchronized (seen) {
                seen.add(f);
            }
            return List.of();
        });

        orchestrator(source, source).fetchAll(filter);

        assertEquals(List.of(filter, filter), seen);
    }

    @Test
    void testNewestFirstWithMissingDatesLast() {
        PooledMarket undated = record("A", "1", "Undated?", null).toPooledMarket();
        PooledMarket old = record("A", "2", "Old?", utc(1)).toPooledMarket();
        PooledMarket recent = record("A", "3", "Recent?", utc(5)).toPooledMarket();
        PooledMarket naive = record("A", "4", "Naive?", PublishedAt.naive(LocalDateTime.of(2024, 1, 3, 0, 0, 1)))
                .toPooledMarket();

        List<PooledMarket> sorted = FetchOrchestrator.sortNewestFirst(List.of(undated, old, recent, naive));

        assertEquals(List.of("Recent?", "Naive?", "Old?", "Undated?"), questions(sorted));
    }

    @Test
    void testZonedTimestampsNormalizedToUtc() {
        PublishedAt plusTwo = PublishedAt.of(OffsetDateTime.of(2024, 1, 1, 14, 0, 0, 0, ZoneOffset.ofHours(2)));
        PublishedAt naive = PublishedAt.naive(LocalDateTime.of(2024, 1, 1, 14, 0, 1));
        List<PooledMarket> normalized = FetchOrchestrator.normalizeTimestamps(List.of(
                record("A", "1", "Zoned?", plusTwo).toPooledMarket(),
                record("A", "2", "Naive?", naive).toPooledMarket()));

        assertEquals(ZoneOffset.UTC, normalized.get(0).getPublishedAt().getOffset());
        assertEquals(LocalDateTime.of(2024, 1, 1, 12, 0), normalized.get(0).getPublishedAt().getDateTime());
        assertSame(naive, normalized.get(1).getPublishedAt());
    }

    @Test
    void testFirstRecordPerQuestionWins() {
        PooledMarket first = record("A", "1", "Same?", utc(1)).toPooledMarket();
        PooledMarket second = record("B", "1", "Same?", utc(2)).toPooledMarket();

        List<PooledMarket> unique = FetchOrchestrator.deduplicate(List.of(first, second));

        assertEquals(List.of(first), unique);
    }
}

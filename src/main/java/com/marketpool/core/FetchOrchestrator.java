package com.marketpool.core;

import com.marketpool.adapter.PlatformMarket;
import com.marketpool.adapter.SourceAdapter;
import com.marketpool.adapter.SourceSession;
import com.marketpool.domain.MarketFilter;
import com.marketpool.domain.PooledMarket;
import com.marketpool.domain.PublishedAt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs every source concurrently and merges their canonical records.
 * <p>
 * A source that fails in any way contributes an empty list; the run itself
 * never fails because of a source. Duplicates by question text keep the record
 * that arrived first, which depends on which source finished first.
 */
@Slf4j
@Service
public class FetchOrchestrator {

    private static final Comparator<PooledMarket> NEWEST_FIRST = Comparator.comparing(
            PooledMarket::getPublishedAt, Comparator.nullsLast(Comparator.<PublishedAt>reverseOrder()));

    private final List<SourceAdapter<?>> adapters;

    public FetchOrchestrator(List<SourceAdapter<?>> adapters) {
        this.adapters = List.copyOf(adapters);
    }

    public List<PooledMarket> fetchAll(MarketFilter filter) {
        if (adapters.isEmpty()) {
            log.warn("No market sources registered");
            return List.of();
        }
        log.info("Fetching from {} sources...", adapters.size());

        Queue<List<PooledMarket>> completed = new ConcurrentLinkedQueue<>();
        ExecutorService executor = Executors.newFixedThreadPool(adapters.size());
        try {
            // all tasks are started before any is awaited
            List<CompletableFuture<Void>> tasks = new ArrayList<>();
            for (SourceAdapter<?> adapter : adapters) {
                tasks.add(CompletableFuture
                        .supplyAsync(() -> runSource(adapter, filter), executor)
                        .exceptionally(e -> {
                            log.warn("[{}] Source task died: {}", adapter.platformName(), e.toString());
                            return List.of();
                        })
                        .thenAccept(completed::add));
            }
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
        } finally {
            shutdown(executor);
        }

        List<PooledMarket> all = new ArrayList<>();
        completed.forEach(all::addAll);
        List<PooledMarket> unique = deduplicate(all);
        List<PooledMarket> result = sortNewestFirst(normalizeTimestamps(unique));
        log.info("Aggregated {} records into {} unique markets", all.size(), result.size());
        return result;
    }

    private <M extends PlatformMarket> List<PooledMarket> runSource(SourceAdapter<M> adapter, MarketFilter filter) {
        String platform = adapter.platformName();
        long start = System.currentTimeMillis();
        log.info("[{}] Starting fetch", platform);
        SourceSession<M> session;
        try {
            session = adapter.openSession();
        } catch (RuntimeException e) {
            return failed(platform, e);
        }
        try {
            List<M> raw = session.fetchMarkets(filter);
            List<PooledMarket> converted = convert(platform, raw);
            log.info("[{}] Fetched {} records, converted {} in {} ms", platform, raw.size(), converted.size(),
                    System.currentTimeMillis() - start);
            return converted;
        } catch (RuntimeException e) {
            return failed(platform, e);
        } finally {
            close(platform, session);
        }
    }

    private static List<PooledMarket> failed(String platform, RuntimeException e) {
        log.warn("[{}] Source failed, contributing no records: {}", platform, e.getMessage());
        log.debug("[{}] Failure detail", platform, e);
        return List.of();
    }

    // records already fetched are kept when only the release fails
    private static void close(String platform, SourceSession<?> session) {
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to release session: {}", platform, e.getMessage());
        }
    }

    private static List<PooledMarket> convert(String platform, List<? extends PlatformMarket> raw) {
        List<PooledMarket> out = new ArrayList<>(raw.size());
        for (PlatformMarket market : raw) {
            try {
                out.add(market.toPooledMarket());
            } catch (RuntimeException e) {
                log.warn("[{}] Skipping record that failed conversion: {}", platform, e.getMessage());
            }
        }
        return out;
    }

    static List<PooledMarket> deduplicate(List<PooledMarket> markets) {
        Map<String, PooledMarket> byQuestion = new LinkedHashMap<>();
        for (PooledMarket market : markets) {
            byQuestion.putIfAbsent(market.getQuestion(), market);
        }
        return new ArrayList<>(byQuestion.values());
    }

    static List<PooledMarket> normalizeTimestamps(List<PooledMarket> markets) {
        try {
            List<PooledMarket> out = new ArrayList<>(markets.size());
            for (PooledMarket market : markets) {
                PublishedAt published = market.getPublishedAt();
                out.add(published == null || !published.isZoned() ? market : market.withPublishedAt(published.toUtc()));
            }
            return out;
        } catch (RuntimeException e) {
            log.warn("Could not normalize timestamps to UTC, keeping them as fetched: {}", e.getMessage());
            return markets;
        }
    }

    static List<PooledMarket> sortNewestFirst(List<PooledMarket> markets) {
        List<PooledMarket> sorted = new ArrayList<>(markets);
        sorted.sort(NEWEST_FIRST);
        return sorted;
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

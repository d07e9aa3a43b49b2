package com.marketpool.adapter;

import com.marketpool.error.TransientFetchException;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Sequential, bounded pagination shared by the paged adapters.
 * <p>
 * Stops after {@code maxPages}, on a page with no new items, on a short page
 * (when {@code pageSize} is known), or on a page whose items all fall below the
 * participation floor (sources are sorted by that metric, descending). A failed
 * first page fails the walk; a failed later page just ends it.
 */
@Slf4j
@Builder
public class PageWalker<I> {

    @NonNull
    private final String platform;

    @Builder.Default
    private final int maxPages = 20;

    // 0 when the source does not promise full pages
    @Builder.Default
    private final int pageSize = 0;

    @Builder.Default
    @NonNull
    private final CoolDown pageCoolDown = CoolDown.NONE;

    @NonNull
    private final Function<I, String> identity;

    // null when the source is not sorted by participation
    private final Predicate<I> belowFloor;

    public List<I> walk(PageFetcher<I> fetcher) {
        List<I> collected = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<I> previous = List.of();

        for (int page = 1; page <= maxPages; page++) {
            if (page > 1) {
                pageCoolDown.pause();
            }

            List<I> items;
            try {
                items = fetcher.fetchPage(page, previous);
            } catch (TransientFetchException e) {
                if (page == 1) {
                    throw e;
                }
                log.warn("[{}] Page {} unavailable, treating as end of data: {}", platform, page, e.getMessage());
                break;
            }

            List<I> fresh = new ArrayList<>();
            for (I item : items) {
                if (item != null && seen.add(identity.apply(item))) {
                    fresh.add(item);
                }
            }
            if (fresh.isEmpty()) {
                log.debug("[{}] Page {} brought nothing new, stopping", platform, page);
                break;
            }
            collected.addAll(fresh);
            previous = items;

            if (belowFloor != null && fresh.stream().allMatch(belowFloor)) {
                log.debug("[{}] Page {} is entirely below the participation floor, stopping", platform, page);
                break;
            }
            if (pageSize > 0 && items.size() < pageSize) {
                break;
            }
        }
        log.info("[{}] Collected {} items", platform, collected.size());
        return collected;
    }
}

package com.marketpool.adapter;

import java.util.List;

@FunctionalInterface
public interface PageFetcher<I> {

    /**
     * @param pageNumber   1-based
     * @param previousPage items of the previous page, empty for the first one (cursor sources read the last id)
     */
    List<I> fetchPage(int pageNumber, List<I> previousPage);
}

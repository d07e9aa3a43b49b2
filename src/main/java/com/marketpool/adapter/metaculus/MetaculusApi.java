package com.marketpool.adapter.metaculus;

import lombok.Value;

import java.util.List;

/**
 * Question query client. One call returns one page.
 */
public interface MetaculusApi {

    QuestionPage fetchQuestions(MetaculusQuery query, int offset);

    @Value
    class QuestionPage {
        List<MetaculusMarket> questions;
        boolean hasMore;
    }
}

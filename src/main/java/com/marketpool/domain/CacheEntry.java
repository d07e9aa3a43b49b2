package com.marketpool.domain;

import lombok.Value;

/**
 * One content-addressed embedding: {@code textHash = sha256(text.strip())}.
 */
@Value
public class CacheEntry {

    String textHash;
    String text;
    double[] embedding;

    public static CacheEntry of(String text, double[] embedding) {
        String normalized = TextHasher.normalize(text);
        return new CacheEntry(TextHasher.hash(normalized), normalized, embedding.clone());
    }

    public double[] getEmbedding() {
        return embedding.clone();
    }
}

package com.marketpool.infra;

import java.util.List;

/**
 * External text embedding service.
 * <p>
 * Contract: for {@code n} texts, exactly {@code n} vectors of {@link #dimension()}
 * entries, in input order.
 */
public interface EmbeddingProvider {

    List<double[]> embed(List<String> texts);

    String model();

    int dimension();
}

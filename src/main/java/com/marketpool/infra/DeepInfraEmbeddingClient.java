package com.marketpool.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketpool.error.ConfigurationException;
import com.marketpool.error.ProviderContractException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible {@code /embeddings} endpoint (DeepInfra by default).
 */
@Slf4j
@Component
public class DeepInfraEmbeddingClient implements EmbeddingProvider {

    static final String TOKEN_ENV = "DEEPINFRA_TOKEN";

    private final HttpSessionFactory sessionFactory;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final int dimension;

    public DeepInfraEmbeddingClient(HttpSessionFactory sessionFactory,
            @Value("${marketpool.embedding.api-key:}") String apiKey,
            @Value("${marketpool.embedding.base-url:https://api.deepinfra.com/v1/openai}") String baseUrl,
            @Value("${marketpool.embedding.model:BAAI/bge-m3}") String model,
            @Value("${marketpool.embedding.dimension:1024}") int dimension) {
        this.sessionFactory = sessionFactory;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.dimension = dimension;
    }

    @Override
    public List<double[]> embed(List<String> texts) {
        if (apiKey == null || apiKey.isBlank()) {
            throw ConfigurationException.missing("Embedding provider credential", TOKEN_ENV);
        }
        if (texts.isEmpty()) {
            return List.of();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", texts);
        payload.put("encoding_format", "float");

        JsonNode response;
        try (HttpSession session = sessionFactory.open(Map.of("Authorization", "Bearer " + apiKey))) {
            response = session.postJson(baseUrl + "/embeddings", payload);
        }
        List<double[]> vectors = parseVectors(response, texts.size());
        log.debug("Embedded {} texts with {}", texts.size(), model);
        return vectors;
    }

    List<double[]> parseVectors(JsonNode response, int expected) {
        JsonNode data = response.path("data");
        if (!data.isArray() || data.size() != expected) {
            throw new ProviderContractException("Expected " + expected + " embeddings, got "
                    + (data.isArray() ? data.size() : "no data array"));
        }
        double[][] ordered = new double[expected][];
        for (int i = 0; i < data.size(); i++) {
            JsonNode item = data.get(i);
            int index = item.path("index").asInt(i);
            if (index < 0 || index >= expected || ordered[index] != null) {
                throw new ProviderContractException("Embedding index " + index + " is out of range or repeated");
            }
            JsonNode values = item.path("embedding");
            if (!values.isArray() || values.size() != dimension) {
                throw new ProviderContractException("Embedding " + index + " has "
                        + (values.isArray() ? values.size() : 0) + " values, expected " + dimension);
            }
            double[] vector = new double[dimension];
            for (int j = 0; j < dimension; j++) {
                vector[j] = values.get(j).asDouble();
            }
            ordered[index] = vector;
        }
        List<double[]> out = new ArrayList<>(expected);
        for (double[] vector : ordered) {
            out.add(vector);
        }
        return out;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public int dimension() {
        return dimension;
    }
}

package org.oralhistory.rag.chat;

import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@link EmbeddingProvider} calling the OpenAI embeddings endpoint. Failures are
 * reported as {@link EmbeddingProviderException} and never retried here.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final RestClient restClient;
    private final String model;

    public OpenAiEmbeddingProvider(RestClient.Builder builder, OpenAiClientProperties properties) {
        Objects.requireNonNull(builder, "builder");
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'spring.ai.openai.api-key' must be provided when mock embeddings are disabled");
        }
        this.model = properties.getEmbeddingModel();
        this.restClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .build();
    }

    @Override
    public float[] embed(String text) {
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("model", model, "input", text == null ? "" : text))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new EmbeddingProviderException("Embedding request with model " + model + " failed", ex);
        }
        JsonNode vector = response == null ? null : response.path("data").path(0).path("embedding");
        if (vector == null || !vector.isArray() || vector.isEmpty()) {
            throw new EmbeddingProviderException("Embedding response of model " + model + " contains no vector");
        }
        float[] embedding = new float[vector.size()];
        for (int i = 0; i < embedding.length; i++) {
            embedding[i] = (float) vector.get(i).asDouble();
        }
        LOGGER.debug("Embedded {} characters into {} dimensions", text == null ? 0 : text.length(), embedding.length);
        return embedding;
    }
}

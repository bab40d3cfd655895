package org.oralhistory.rag.chat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@link LlmClient} backed by the OpenAI chat completions endpoint.
 */
class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final OpenAiClientProperties properties;
    private final RestClient restClient;

    OpenAiLlmClient(RestClient.Builder builder, OpenAiClientProperties properties) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'spring.ai.openai.api-key' must be provided when mocks are disabled");
        }
        this.properties = properties;
        this.restClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .build();
    }

    @Override
    public String chat(String systemPrompt, List<ConversationTurn> history, String question) {
        LOGGER.debug("Requesting completion with model {} via base URL {}", properties.getModel(),
                properties.getBaseUrl());
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestBody(systemPrompt, history, question))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new LlmClientException("Completion request with model " + properties.getModel() + " failed", ex);
        }
        JsonNode content = response == null ? null : response.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new LlmClientException("Completion response of model " + properties.getModel() + " has no content");
        }
        return content.asText();
    }

    private Map<String, Object> requestBody(String systemPrompt, List<ConversationTurn> history, String question) {
        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(message("system", systemPrompt));
        history.forEach(turn -> messages.add(message(turn.role().apiName(), turn.content())));
        messages.add(message(ConversationTurn.Role.USER.apiName(), question));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.getModel());
        body.put("messages", messages);
        body.put("temperature", properties.getTemperature());
        body.put("max_tokens", properties.getMaxTokens());
        body.put("presence_penalty", properties.getPresencePenalty());
        body.put("frequency_penalty", properties.getFrequencyPenalty());
        return body;
    }

    private static Map<String, String> message(String role, String content) {
        return Map.of("role", role, "content", content);
    }
}

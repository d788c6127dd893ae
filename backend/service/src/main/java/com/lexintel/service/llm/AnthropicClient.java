package com.lexintel.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexintel.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class AnthropicClient implements LlmClient {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final URI DEFAULT_ENDPOINT = URI.create("https://api.anthropic.com/v1/messages");

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final Duration timeout;

    public AnthropicClient(HttpClient httpClient, String apiKey, String model, Duration timeout) {
        this(httpClient, DEFAULT_ENDPOINT, apiKey, model, 8192, timeout);
    }

    public AnthropicClient(HttpClient httpClient, URI endpoint, String apiKey, String model, int maxTokens, Duration timeout) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
        this.timeout = timeout;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public LlmClient withModel(String other) {
        return other.equals(model) ? this : new AnthropicClient(httpClient, endpoint, apiKey, other, maxTokens, timeout);
    }

    @Override
    public CompletableFuture<String> complete(String prompt, String schemaHint) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("max_tokens", maxTokens);
        if (schemaHint != null && !schemaHint.isBlank()) {
            payload.put("system", schemaHint);
        }
        payload.put("messages", List.of(Map.of("role", "user", "content", prompt)));

        byte[] body;
        try {
            body = MAPPER.writeValueAsBytes(payload);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new LlmException("Unable to encode model request", e));
        }
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("x-api-key", apiKey)
                .header("anthropic-version", "2023-06-01")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw new LlmException("Model request failed", error);
                    }
                    if (response.statusCode() / 100 != 2) {
                        throw new LlmException("Model API returned HTTP " + response.statusCode());
                    }
                    return extractText(response.body());
                });
    }

    static String extractText(String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new LlmException("Model API response is not JSON", e);
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        if (text.length() == 0) {
            throw new LlmException("Model API response has no text content");
        }
        return text.toString();
    }
}

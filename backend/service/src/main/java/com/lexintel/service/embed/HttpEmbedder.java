package com.lexintel.service.embed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexintel.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class HttpEmbedder implements Embedder {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final String model;
    private final Duration timeout;

    public HttpEmbedder(HttpClient httpClient, URI endpoint, String apiKey, String model, Duration timeout) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.timeout = timeout;
    }

    @Override
    public CompletableFuture<double[]> embed(String text) {
        HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("Authorization", "Bearer " + apiKey);
        }
        try {
            Map<String, Object> payload = model == null || model.isBlank()
                    ? Map.of("input", text)
                    : Map.of("input", text, "model", model);
            request.POST(HttpRequest.BodyPublishers.ofByteArray(MAPPER.writeValueAsBytes(payload)));
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new EmbeddingException("Unable to encode embedding request", e));
        }
        return httpClient.sendAsync(request.build(), HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw new EmbeddingException("Embedding request failed", error);
                    }
                    if (response.statusCode() / 100 != 2) {
                        throw new EmbeddingException("Embedding service returned HTTP " + response.statusCode());
                    }
                    return parseVector(response.body());
                });
    }

    static double[] parseVector(String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new EmbeddingException("Embedding response is not JSON", e);
        }
        JsonNode vector = root.path("embedding");
        if (!vector.isArray()) {
            vector = root.path("data").path(0).path("embedding");
        }
        if (!vector.isArray() || vector.isEmpty()) {
            throw new EmbeddingException("Embedding response has no vector");
        }
        double[] values = new double[vector.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = vector.get(i).asDouble();
        }
        return values;
    }
}

package com.lexintel.service.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lexintel.core.util.JsonUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

public class DevToAdapter implements PlatformAdapter {
    public static final String PLATFORM = "devto";
    public static final URI DEFAULT_ENDPOINT = URI.create("https://dev.to/api/articles");
    static final List<String> TAGS = List.of("ai", "china", "news");

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final Duration timeout;

    public DevToAdapter(HttpClient httpClient, URI endpoint, String apiKey, Duration timeout) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    @Override
    public String platform() {
        return PLATFORM;
    }

    @Override
    public PublishOutcome publish(PublishRequest request) {
        ObjectNode article = JsonUtils.objectMapper().createObjectNode();
        article.put("title", HttpPublishSupport.fallbackTitle(request));
        article.put("body_markdown", request.body());
        article.put("published", true);
        TAGS.forEach(article.putArray("tags")::add);
        ObjectNode payload = JsonUtils.objectMapper().createObjectNode();
        payload.set("article", article);

        HttpRequest httpRequest = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("api-key", apiKey)
                .header("Content-Type", "application/json")
                .header("Accept", "application/vnd.forem.api-v1+json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build();
        HttpPublishSupport.Sent sent = HttpPublishSupport.send(httpClient, httpRequest);
        if (sent.failure() != null) {
            return sent.failure();
        }
        if (!HttpPublishSupport.successful(sent.response())) {
            return HttpPublishSupport.classify(sent.response());
        }
        Optional<String> id = HttpPublishSupport.readJson(sent.response().body())
                .map(node -> node.path("id"))
                .filter(JsonNode::isValueNode)
                .map(JsonNode::asText)
                .filter(text -> !text.isBlank());
        if (id.isEmpty()) {
            return HttpPublishSupport.unconfirmed(PLATFORM, request, sent.response());
        }
        return PublishOutcome.published(id.get());
    }
}

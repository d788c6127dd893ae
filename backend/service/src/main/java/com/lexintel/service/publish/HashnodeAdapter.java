package com.lexintel.service.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lexintel.core.util.JsonUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Publishes long-form posts through the Hashnode GraphQL API. GraphQL reports most
 * failures with HTTP 200 and an {@code errors} array, so those are classified by their
 * error code.
 */
public class HashnodeAdapter implements PlatformAdapter {
    public static final String PLATFORM = "hashnode";
    public static final URI DEFAULT_ENDPOINT = URI.create("https://gql.hashnode.com/");

    private static final Set<String> AUTH_CODES = Set.of("UNAUTHENTICATED", "FORBIDDEN");
    private static final Set<String> CONTENT_CODES =
            Set.of("BAD_USER_INPUT", "GRAPHQL_VALIDATION_FAILED", "VALIDATION_ERROR");

    static final String MUTATION = """
            mutation PublishPost($input: PublishPostInput!) {
              publishPost(input: $input) {
                post { id }
              }
            }
            """;

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String apiKey;
    private final String publicationId;
    private final Duration timeout;

    public HashnodeAdapter(HttpClient httpClient, URI endpoint, String apiKey, String publicationId, Duration timeout) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.publicationId = publicationId;
        this.timeout = timeout;
    }

    @Override
    public String platform() {
        return PLATFORM;
    }

    @Override
    public PublishOutcome publish(PublishRequest request) {
        HttpRequest httpRequest = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Authorization", apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload(request).toString()))
                .build();
        HttpPublishSupport.Sent sent = HttpPublishSupport.send(httpClient, httpRequest);
        if (sent.failure() != null) {
            return sent.failure();
        }
        if (!HttpPublishSupport.successful(sent.response())) {
            return HttpPublishSupport.classify(sent.response());
        }
        Optional<JsonNode> root = HttpPublishSupport.readJson(sent.response().body());
        if (root.isEmpty()) {
            return HttpPublishSupport.unconfirmed(PLATFORM, request, sent.response());
        }
        JsonNode errors = root.get().path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            return classifyErrors(errors);
        }
        JsonNode id = root.get().path("data").path("publishPost").path("post").path("id");
        if (!id.isValueNode() || id.asText().isBlank()) {
            return HttpPublishSupport.unconfirmed(PLATFORM, request, sent.response());
        }
        return PublishOutcome.published(id.asText());
    }

    private ObjectNode payload(PublishRequest request) {
        ObjectNode input = JsonUtils.objectMapper().createObjectNode();
        input.put("title", HttpPublishSupport.fallbackTitle(request));
        input.put("contentMarkdown", request.body());
        input.put("publicationId", publicationId);
        ArrayNode tags = input.putArray("tags");
        tags.addObject().put("slug", "artificial-intelligence").put("name", "Artificial Intelligence");
        tags.addObject().put("slug", "china").put("name", "China");
        tags.addObject().put("slug", "technology-news").put("name", "Technology News");

        ObjectNode payload = JsonUtils.objectMapper().createObjectNode();
        payload.put("query", MUTATION);
        payload.putObject("variables").set("input", input);
        return payload;
    }

    static PublishOutcome.Failed classifyErrors(JsonNode errors) {
        JsonNode first = errors.get(0);
        String code = first.path("extensions").path("code").asText("").toUpperCase(Locale.ROOT);
        String message = "Hashnode GraphQL error " + (code.isEmpty() ? "" : code + ": ")
                + first.path("message").asText("unknown");
        if (AUTH_CODES.contains(code)) {
            return PublishOutcome.authFailure(message);
        }
        if (CONTENT_CODES.contains(code)) {
            return PublishOutcome.contentRejected(message);
        }
        return PublishOutcome.transientFailure(message);
    }
}

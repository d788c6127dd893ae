package com.lexintel.service.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexintel.core.util.JsonUtils;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DevToAdapterTest {
    private static final PublishRequest REQUEST =
            new PublishRequest("item-1", "Moonshot raises $1B", "## Body\n\nDetails.", "primary");

    private HttpServer server;
    private final AtomicReference<String> apiKey = new AtomicReference<>();
    private final AtomicReference<String> body = new AtomicReference<>();

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void createdArticleReturnsItsId() throws Exception {
        start(201, "{\"id\": 98765, \"url\": \"https://dev.to/x\"}", null);

        PublishOutcome outcome = adapter().publish(REQUEST);

        assertEquals(new PublishOutcome.Published("98765"), outcome);
        assertEquals("secret", apiKey.get());
        JsonNode article = JsonUtils.objectMapper().readTree(body.get()).path("article");
        assertEquals("Moonshot raises $1B", article.path("title").asText());
        assertEquals("## Body\n\nDetails.", article.path("body_markdown").asText());
        assertTrue(article.path("published").asBoolean());
        assertEquals(3, article.path("tags").size());
    }

    @Test
    void rateLimitIsTransientWithRetryAfter() throws Exception {
        start(429, "{\"error\": \"rate limit\"}", "120");

        PublishOutcome.Failed failed = assertInstanceOf(PublishOutcome.Failed.class, adapter().publish(REQUEST));

        assertEquals(PublishOutcome.FailureKind.TRANSIENT, failed.kind());
        assertEquals(Duration.ofSeconds(120), failed.retryAfter());
    }

    @Test
    void statusCodesMapToFailureKinds() throws Exception {
        start(401, "{\"error\": \"unauthorized\"}", null);
        assertEquals(PublishOutcome.FailureKind.AUTH, failureKind());
        server.stop(0);

        start(422, "{\"error\": \"Body markdown is too long\"}", null);
        PublishOutcome.Failed content = assertInstanceOf(PublishOutcome.Failed.class, adapter().publish(REQUEST));
        assertEquals(PublishOutcome.FailureKind.CONTENT, content.kind());
        assertTrue(content.message().contains("422"));
        server.stop(0);

        start(503, "unavailable", null);
        assertEquals(PublishOutcome.FailureKind.TRANSIENT, failureKind());
    }

    @Test
    void successWithoutIdIsNotResent() throws Exception {
        start(200, "{}", null);

        PublishOutcome.Failed failed = assertInstanceOf(PublishOutcome.Failed.class, adapter().publish(REQUEST));

        assertEquals(PublishOutcome.FailureKind.UNCONFIRMED, failed.kind());
        assertFalse(failed.retryable());
    }

    @Test
    void unreachableEndpointIsTransient() {
        DevToAdapter adapter = new DevToAdapter(HttpClient.newHttpClient(), URI.create("http://127.0.0.1:1/api/articles"),
                "secret", Duration.ofSeconds(2));

        PublishOutcome.Failed failed = assertInstanceOf(PublishOutcome.Failed.class, adapter.publish(REQUEST));
        assertTrue(failed.retryable());
    }

    @Test
    void untitledRequestUsesStartOfBody() throws Exception {
        start(201, "{\"id\": 1}", null);

        adapter().publish(new PublishRequest("item-2", " ", "x".repeat(100), "fallback"));

        String title = JsonUtils.objectMapper().readTree(body.get()).path("article").path("title").asText();
        assertEquals(60, title.length());
    }

    private PublishOutcome.FailureKind failureKind() {
        return assertInstanceOf(PublishOutcome.Failed.class, adapter().publish(REQUEST)).kind();
    }

    private DevToAdapter adapter() {
        URI endpoint = URI.create("http://localhost:" + server.getAddress().getPort() + "/api/articles");
        return new DevToAdapter(HttpClient.newHttpClient(), endpoint, "secret", Duration.ofSeconds(2));
    }

    private void start(int status, String responseBody, String retryAfter) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/api/articles", exchange -> {
            apiKey.set(exchange.getRequestHeaders().getFirst("api-key"));
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            if (retryAfter != null) {
                exchange.getResponseHeaders().add("Retry-After", retryAfter);
            }
            writeResponse(exchange, status, responseBody);
        });
        server.start();
    }

    private static void writeResponse(HttpExchange exchange, int status, String responseBody) throws IOException {
        byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}

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

class HashnodeAdapterTest {
    private static final PublishRequest REQUEST =
            new PublishRequest("item-1", "CAC issues rules", "Rules body", "primary");

    private HttpServer server;
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private final AtomicReference<String> body = new AtomicReference<>();

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void publishedPostReturnsItsId() throws Exception {
        start(200, "{\"data\": {\"publishPost\": {\"post\": {\"id\": \"post-42\"}}}}");

        PublishOutcome outcome = adapter().publish(REQUEST);

        assertEquals(new PublishOutcome.Published("post-42"), outcome);
        assertEquals("token", authorization.get());
        JsonNode payload = JsonUtils.objectMapper().readTree(body.get());
        assertTrue(payload.path("query").asText().contains("publishPost"));
        JsonNode input = payload.path("variables").path("input");
        assertEquals("pub-1", input.path("publicationId").asText());
        assertEquals("Rules body", input.path("contentMarkdown").asText());
        assertEquals("china", input.path("tags").get(1).path("slug").asText());
    }

    @Test
    void graphQlErrorsAreClassifiedByCode() throws Exception {
        start(200, "{\"errors\": [{\"message\": \"Bad tags\", \"extensions\": {\"code\": \"BAD_USER_INPUT\"}}]}");

        PublishOutcome.Failed failed = assertInstanceOf(PublishOutcome.Failed.class, adapter().publish(REQUEST));

        assertEquals(PublishOutcome.FailureKind.CONTENT, failed.kind());
        assertTrue(failed.message().contains("Bad tags"));
    }

    @Test
    void classifyErrorsCoversAuthAndUnknownCodes() throws Exception {
        JsonNode auth = JsonUtils.objectMapper().readTree(
                "[{\"message\": \"nope\", \"extensions\": {\"code\": \"UNAUTHENTICATED\"}}]");
        JsonNode unknown = JsonUtils.objectMapper().readTree("[{\"message\": \"Internal\"}]");

        assertEquals(PublishOutcome.FailureKind.AUTH, HashnodeAdapter.classifyErrors(auth).kind());
        assertEquals(PublishOutcome.FailureKind.TRANSIENT, HashnodeAdapter.classifyErrors(unknown).kind());
    }

    @Test
    void httpFailuresUseSharedClassification() throws Exception {
        start(403, "{}");

        PublishOutcome.Failed failed = assertInstanceOf(PublishOutcome.Failed.class, adapter().publish(REQUEST));

        assertEquals(PublishOutcome.FailureKind.AUTH, failed.kind());
    }

    @Test
    void missingPostIdIsNotResent() throws Exception {
        start(200, "{\"data\": {\"publishPost\": null}}");

        PublishOutcome.Failed failed = assertInstanceOf(PublishOutcome.Failed.class, adapter().publish(REQUEST));

        assertEquals(PublishOutcome.FailureKind.UNCONFIRMED, failed.kind());
        assertFalse(failed.retryable());
        assertTrue(failed.message().contains("without a post id"));
    }

    @Test
    void unreadableSuccessBodyIsNotResent() throws Exception {
        start(200, "<html>ok</html>");

        PublishOutcome.Failed failed = assertInstanceOf(PublishOutcome.Failed.class, adapter().publish(REQUEST));

        assertEquals(PublishOutcome.FailureKind.UNCONFIRMED, failed.kind());
    }

    private HashnodeAdapter adapter() {
        URI endpoint = URI.create("http://localhost:" + server.getAddress().getPort() + "/graphql");
        return new HashnodeAdapter(HttpClient.newHttpClient(), endpoint, "token", "pub-1", Duration.ofSeconds(2));
    }

    private void start(int status, String responseBody) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/graphql", exchange -> {
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
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

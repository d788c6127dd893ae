package com.lexintel.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexintel.core.util.JsonUtils;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnthropicClientTest {
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
    void sendsPromptWithSchemaHintAndJoinsTextBlocks() throws Exception {
        start(200, "{\"content\": [{\"type\": \"text\", \"text\": \"[{\\\"index\\\": 0\"},"
                + "{\"type\": \"tool_use\", \"id\": \"x\"},{\"type\": \"text\", \"text\": \"}]\"}]}");

        String reply = client().complete("Classify these", "Return a JSON array").join();

        assertEquals("[{\"index\": 0}]", reply);
        assertEquals("secret", apiKey.get());
        JsonNode request = JsonUtils.objectMapper().readTree(body.get());
        assertEquals("test-model", request.path("model").asText());
        assertEquals(1024, request.path("max_tokens").asInt());
        assertEquals("Return a JSON array", request.path("system").asText());
        assertEquals("Classify these", request.path("messages").path(0).path("content").asText());
    }

    @Test
    void errorStatusFailsWithLlmException() throws Exception {
        start(529, "{\"type\": \"error\"}");

        CompletionException error = assertThrows(CompletionException.class, () -> client().complete("x", null).join());

        LlmException cause = assertInstanceOf(LlmException.class, error.getCause());
        assertTrue(cause.getMessage().contains("529"));
    }

    @Test
    void replyWithoutTextIsAnError() {
        assertThrows(LlmException.class, () -> AnthropicClient.extractText("{\"content\": []}"));
        assertThrows(LlmException.class, () -> AnthropicClient.extractText("not json"));
    }

    @Test
    void unavailableClientFailsEveryCall() {
        LlmClient unavailable = LlmClient.unavailable("claude-x");

        CompletionException error = assertThrows(CompletionException.class,
                () -> unavailable.complete("x", "y").join());
        assertInstanceOf(LlmException.class, error.getCause());
        assertEquals("claude-x", unavailable.model());
    }

    private AnthropicClient client() {
        URI endpoint = URI.create("http://localhost:" + server.getAddress().getPort() + "/v1/messages");
        return new AnthropicClient(HttpClient.newHttpClient(), endpoint, "secret", "test-model", 1024,
                Duration.ofSeconds(2));
    }

    private void start(int status, String response) throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/messages", exchange -> {
            apiKey.set(exchange.getRequestHeaders().getFirst("x-api-key"));
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] payload = response.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, payload.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(payload);
            }
        });
        server.start();
    }
}

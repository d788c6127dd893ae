package com.lexintel.service.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexintel.core.util.JsonUtils;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

final class HttpPublishSupport {
    private static final Logger LOGGER = Logger.getLogger(HttpPublishSupport.class.getName());
    private static final int SNIPPET = 300;

    private HttpPublishSupport() {
    }

    static Sent send(HttpClient client, HttpRequest request) {
        try {
            return new Sent(client.send(request, HttpResponse.BodyHandlers.ofString()), null);
        } catch (HttpTimeoutException e) {
            return new Sent(null, PublishOutcome.transientFailure("Request timed out: " + e.getMessage()));
        } catch (IOException e) {
            return new Sent(null, PublishOutcome.transientFailure("Network error: " + e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Sent(null, PublishOutcome.transientFailure("Interrupted while publishing"));
        }
    }

    /**
     * Maps a non-2xx response: 429 and 5xx are transient, 401/403 are auth failures,
     * other 4xx are content rejections.
     */
    static PublishOutcome.Failed classify(HttpResponse<String> response) {
        int status = response.statusCode();
        String message = "HTTP " + status + ": " + snippet(response.body());
        if (status == 429) {
            return PublishOutcome.transientFailure(message, retryAfter(response).orElse(null));
        }
        if (status >= 500) {
            return PublishOutcome.transientFailure(message);
        }
        if (status == 401 || status == 403) {
            return PublishOutcome.authFailure(message);
        }
        if (status == 408) {
            return PublishOutcome.transientFailure(message);
        }
        return PublishOutcome.contentRejected(message);
    }

    static PublishOutcome.Failed unconfirmed(String platform, PublishRequest request, HttpResponse<String> response) {
        String message = platform + " answered HTTP " + response.statusCode() + " without a post id: "
                + snippet(response.body());
        LOGGER.warning("Item " + request.itemId() + " may already be live on " + platform
                + "; not resending. Check the platform before requeueing. " + message);
        return PublishOutcome.unconfirmed(message);
    }

    static boolean successful(HttpResponse<String> response) {
        return response.statusCode() >= 200 && response.statusCode() < 300;
    }

    static Optional<JsonNode> readJson(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(JsonUtils.objectMapper().readTree(body));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    // Delay-seconds form of Retry-After only; HTTP-date values are ignored.
    static Optional<Duration> retryAfter(HttpResponse<String> response) {
        return response.headers().firstValue("Retry-After")
                .map(String::trim)
                .filter(value -> value.matches("\\d+"))
                .map(value -> Duration.ofSeconds(Long.parseLong(value)));
    }

    static String fallbackTitle(PublishRequest request) {
        if (request.title() != null && !request.title().isBlank()) {
            return request.title();
        }
        String body = request.body().strip();
        return body.length() <= 60 ? body : body.substring(0, 60);
    }

    static String snippet(String body) {
        if (body == null) {
            return "";
        }
        String flat = body.replaceAll("\\s+", " ").trim();
        return flat.length() <= SNIPPET ? flat : flat.substring(0, SNIPPET) + "...";
    }

    record Sent(HttpResponse<String> response, PublishOutcome.Failed failure) {
    }
}

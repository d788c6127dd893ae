package com.lexintel.service.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lexintel.core.util.JsonUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

public class LinkedInAdapter implements PlatformAdapter {
    public static final String PLATFORM = "linkedin";
    public static final URI DEFAULT_BASE = URI.create("https://api.linkedin.com/v2/");
    static final int MAX_COMMENTARY_CHARS = 3000;

    private final HttpClient httpClient;
    private final URI base;
    private final String accessToken;
    private final Duration timeout;

    public LinkedInAdapter(HttpClient httpClient, URI base, String accessToken, Duration timeout) {
        this.httpClient = httpClient;
        this.base = base;
        this.accessToken = accessToken;
        this.timeout = timeout;
    }

    @Override
    public String platform() {
        return PLATFORM;
    }

    @Override
    public PublishOutcome publish(PublishRequest request) {
        HttpRequest userinfo = HttpRequest.newBuilder(base.resolve("userinfo"))
                .timeout(timeout)
                .header("Authorization", "Bearer " + accessToken)
                .GET()
                .build();
        HttpPublishSupport.Sent me = HttpPublishSupport.send(httpClient, userinfo);
        if (me.failure() != null) {
            return me.failure();
        }
        if (!HttpPublishSupport.successful(me.response())) {
            return HttpPublishSupport.classify(me.response());
        }
        Optional<String> subject = HttpPublishSupport.readJson(me.response().body())
                .map(node -> node.path("sub"))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .filter(text -> !text.isBlank());
        if (subject.isEmpty()) {
            return PublishOutcome.transientFailure("LinkedIn userinfo carried no subject: "
                    + HttpPublishSupport.snippet(me.response().body()));
        }

        HttpRequest post = HttpRequest.newBuilder(base.resolve("ugcPosts"))
                .timeout(timeout)
                .header("Authorization", "Bearer " + accessToken)
                .header("X-Restli-Protocol-Version", "2.0.0")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload("urn:li:person:" + subject.get(), request).toString()))
                .build();
        HttpPublishSupport.Sent sent = HttpPublishSupport.send(httpClient, post);
        if (sent.failure() != null) {
            return sent.failure();
        }
        if (!HttpPublishSupport.successful(sent.response())) {
            return HttpPublishSupport.classify(sent.response());
        }
        Optional<String> id = postId(sent.response());
        if (id.isEmpty()) {
            return HttpPublishSupport.unconfirmed(PLATFORM, request, sent.response());
        }
        return PublishOutcome.published(id.get());
    }

    static ObjectNode payload(String author, PublishRequest request) {
        String text = request.body().length() <= MAX_COMMENTARY_CHARS
                ? request.body()
                : request.body().substring(0, MAX_COMMENTARY_CHARS);
        ObjectNode payload = JsonUtils.objectMapper().createObjectNode();
        payload.put("author", author);
        payload.put("lifecycleState", "PUBLISHED");
        ObjectNode share = payload.putObject("specificContent").putObject("com.linkedin.ugc.ShareContent");
        share.putObject("shareCommentary").put("text", text);
        share.put("shareMediaCategory", "NONE");
        payload.putObject("visibility").put("com.linkedin.ugc.MemberNetworkVisibility", "PUBLIC");
        return payload;
    }

    private static Optional<String> postId(HttpResponse<String> response) {
        Optional<String> header = response.headers().firstValue("x-restli-id").filter(value -> !value.isBlank());
        if (header.isPresent()) {
            return header;
        }
        return HttpPublishSupport.readJson(response.body())
                .map(node -> node.path("id"))
                .filter(JsonNode::isValueNode)
                .map(JsonNode::asText)
                .filter(text -> !text.isBlank());
    }
}

package com.lexintel.collectors.api;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public record FetchContext(
        HttpClient httpClient,
        Clock clock,
        Duration requestTimeout
) {
    public FetchContext {
        Objects.requireNonNull(httpClient, "httpClient is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
    }
}

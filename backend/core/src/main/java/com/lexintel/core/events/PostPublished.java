package com.lexintel.core.events;

import java.time.Instant;

public record PostPublished(
        Instant timestamp,
        String itemId,
        String platform,
        String platformId,
        boolean viaFallback
) implements Event {
    @Override
    public String type() {
        return "PostPublished";
    }
}

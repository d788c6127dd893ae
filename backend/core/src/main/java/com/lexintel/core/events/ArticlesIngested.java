package com.lexintel.core.events;

import java.time.Instant;

public record ArticlesIngested(
        Instant timestamp,
        String source,
        int found,
        int accepted
) implements Event {
    @Override
    public String type() {
        return "ArticlesIngested";
    }
}

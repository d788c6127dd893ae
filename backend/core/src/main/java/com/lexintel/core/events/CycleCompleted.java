package com.lexintel.core.events;

import java.time.Instant;

public record CycleCompleted(
        Instant timestamp,
        String cycleName,
        boolean success,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "CycleCompleted";
    }
}

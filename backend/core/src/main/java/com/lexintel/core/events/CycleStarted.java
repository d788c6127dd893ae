package com.lexintel.core.events;

import java.time.Instant;

public record CycleStarted(Instant timestamp, String cycleName) implements Event {
    @Override
    public String type() {
        return "CycleStarted";
    }
}

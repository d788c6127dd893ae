package com.lexintel.core.events;

import java.time.Instant;

public record PostFailed(
        Instant timestamp,
        String itemId,
        String platform,
        boolean terminal,
        String message
) implements Event {
    @Override
    public String type() {
        return "PostFailed";
    }
}

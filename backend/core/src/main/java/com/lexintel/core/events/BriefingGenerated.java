package com.lexintel.core.events;

import java.time.Instant;

public record BriefingGenerated(
        Instant timestamp,
        String briefingId,
        int articleCount,
        int draftCount
) implements Event {
    @Override
    public String type() {
        return "BriefingGenerated";
    }
}

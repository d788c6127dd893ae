package com.lexintel.core.model;

import java.time.Instant;

public record Briefing(
        String id,
        Instant createdAt,
        String text,
        BriefingSections sections,
        int articleCount,
        String modelUsed,
        String analysisRunId
) {
}

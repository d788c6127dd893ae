package com.lexintel.core.model;

import java.time.Instant;

public record RawRecord(
        String source,
        String sourceId,
        String title,
        String body,
        String url,
        Instant publishedAt
) {
}

package com.lexintel.core.model;

import java.time.Instant;

public record ThreadMember(
        String articleId,
        String source,
        String englishTitle,
        int relevance,
        Instant publishedAt
) {
}

package com.lexintel.core.model;

import java.time.Instant;

public record SourceHealth(
        String source,
        int total,
        int highRelevance,
        double highRelevancePct,
        Instant lastSuccessAt,
        Instant lastFailureAt
) {
}

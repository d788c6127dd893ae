package com.lexintel.core.model;

import java.time.Instant;

public record PublishLogEntry(
        Instant at,
        String status,
        String variant,
        String platformId,
        String error
) {
    public static final String PRIMARY = "primary";
    public static final String FALLBACK = "fallback";

    public static PublishLogEntry published(Instant at, String variant, String platformId) {
        return new PublishLogEntry(at, "published", variant, platformId, null);
    }

    public static PublishLogEntry failed(Instant at, String variant, String error) {
        return new PublishLogEntry(at, "failed", variant, null, error);
    }

    public static PublishLogEntry released(Instant at, String reason) {
        return new PublishLogEntry(at, "released", null, null, reason);
    }
}

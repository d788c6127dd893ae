package com.lexintel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PublishStatus {
    QUEUED,
    PUBLISHING,
    PUBLISHED,
    RETRY_QUEUED,
    FAILED,
    SKIPPED;

    public boolean terminal() {
        return this == PUBLISHED || this == FAILED || this == SKIPPED;
    }

    public boolean claimable() {
        return this == QUEUED || this == RETRY_QUEUED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PublishStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

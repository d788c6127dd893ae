package com.lexintel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunMode {
    SCRAPE,
    ANALYZE,
    PUBLISH,
    FULL_CYCLE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunMode fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.lexintel.service.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public record PlatformConfig(String name, Format format, int maxRetries) {
    public PlatformConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("platform name is required");
        }
        format = format == null ? Format.LONG : format;
        maxRetries = Math.max(0, maxRetries);
    }

    public static List<PlatformConfig> defaults() {
        return List.of(
                new PlatformConfig("devto", Format.LONG, 3),
                new PlatformConfig("hashnode", Format.LONG, 3),
                new PlatformConfig("linkedin", Format.SHORT, 3)
        );
    }

    public enum Format {
        LONG,
        SHORT;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Format fromWire(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}

package com.lexintel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Urgency {
    HIGH("high", 1),
    MEDIUM("medium", 2),
    LOW("low", 3);

    private final String wireName;
    private final int priority;

    Urgency(String wireName, int priority) {
        this.wireName = wireName;
        this.priority = priority;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int priority() {
        return priority;
    }

    public static Optional<Urgency> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Urgency urgency : values()) {
            if (urgency.wireName.equals(normalized)) {
                return Optional.of(urgency);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static Urgency fromJson(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown urgency: " + value));
    }
}

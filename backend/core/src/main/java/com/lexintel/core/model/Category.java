package com.lexintel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Category {
    FUNDING("funding"),
    M_AND_A("m_and_a"),
    PRODUCT("product"),
    REGULATION("regulation"),
    BREAKTHROUGH("breakthrough"),
    PERSONNEL("personnel"),
    MARKET("market"),
    OTHER("other");

    private final String wireName;

    Category(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<Category> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.wireName.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static Category fromJson(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown category: " + value));
    }
}

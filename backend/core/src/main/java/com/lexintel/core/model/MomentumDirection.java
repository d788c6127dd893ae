package com.lexintel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MomentumDirection {
    RISING,
    STABLE,
    DECLINING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

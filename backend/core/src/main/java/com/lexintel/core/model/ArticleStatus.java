package com.lexintel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Article lifecycle. Transitions only move forward: pending, analyzed, published,
 * archived. Skipping ahead is allowed, moving back never is.
 */
public enum ArticleStatus {
    PENDING,
    ANALYZED,
    PUBLISHED,
    ARCHIVED;

    public boolean canAdvanceTo(ArticleStatus next) {
        return next.ordinal() > ordinal();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ArticleStatus fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.lexintel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConfidenceTier {
    HIGH("high", 3),
    MEDIUM("medium", 2),
    SINGLE_SOURCE("single-source", 1);

    private final String wireName;
    private final int rank;

    ConfidenceTier(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    public static ConfidenceTier forDistinctSources(int distinctSources) {
        if (distinctSources >= 3) {
            return HIGH;
        }
        if (distinctSources == 2) {
            return MEDIUM;
        }
        if (distinctSources == 1) {
            return SINGLE_SOURCE;
        }
        throw new IllegalArgumentException("A signal thread needs at least one source");
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int rank() {
        return rank;
    }
}

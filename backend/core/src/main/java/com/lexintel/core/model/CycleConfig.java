package com.lexintel.core.model;

public record CycleConfig(
        String name,
        boolean enabled,
        int intervalSeconds
) {
}

package com.lexintel.core.model;

public record CategoryMomentum(
        Category category,
        int current,
        int previous,
        double changePct,
        MomentumDirection direction
) {
}

package com.lexintel.core.model;

public record DraftPost(
        String articleId,
        Urgency urgency,
        String title,
        String longForm,
        String shortForm
) {
}

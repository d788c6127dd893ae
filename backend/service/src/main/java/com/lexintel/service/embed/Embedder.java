package com.lexintel.service.embed;

import java.util.concurrent.CompletableFuture;

public interface Embedder {
    CompletableFuture<double[]> embed(String text);

    static Embedder unavailable() {
        return text -> CompletableFuture.failedFuture(new EmbeddingException("No embedding service configured"));
    }

    static String embeddingText(String title, String body) {
        String safeTitle = title == null ? "" : title;
        if (body == null || body.isBlank()) {
            return safeTitle;
        }
        String clipped = body.length() > 2000 ? body.substring(0, 2000) : body;
        return safeTitle + "\n\n" + clipped;
    }
}

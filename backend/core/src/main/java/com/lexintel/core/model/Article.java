package com.lexintel.core.model;

import java.time.Instant;
import java.util.Objects;

public record Article(
        String id,
        String source,
        String sourceId,
        String title,
        String titleNorm,
        String url,
        String body,
        Instant publishedAt,
        Instant scrapedAt,
        String englishTitle,
        Category category,
        Integer relevance,
        ArticleStatus status,
        double[] embedding,
        boolean semanticUnverified
) {
    public static final int MIN_RELEVANCE = 1;
    public static final int MAX_RELEVANCE = 5;

    public Article {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(status, "status is required");
        if (titleNorm == null || titleNorm.isBlank()) {
            throw new IllegalArgumentException("titleNorm must not be empty");
        }
        if (relevance != null && (relevance < MIN_RELEVANCE || relevance > MAX_RELEVANCE)) {
            throw new IllegalArgumentException("relevance must be within [1,5] but was " + relevance);
        }
    }

    public Article withEnrichment(String newEnglishTitle, Category newCategory, int newRelevance) {
        Article enriched = new Article(id, source, sourceId, title, titleNorm, url, body, publishedAt, scrapedAt,
                newEnglishTitle, newCategory, newRelevance, status, embedding, semanticUnverified);
        return enriched.advanceTo(ArticleStatus.ANALYZED);
    }

    public Article advanceTo(ArticleStatus next) {
        if (next == status) {
            return this;
        }
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException("Article " + id + " cannot move from " + status + " to " + next);
        }
        return new Article(id, source, sourceId, title, titleNorm, url, body, publishedAt, scrapedAt,
                englishTitle, category, relevance, next, embedding, semanticUnverified);
    }

    public Article withEmbedding(double[] vector) {
        return new Article(id, source, sourceId, title, titleNorm, url, body, publishedAt, scrapedAt,
                englishTitle, category, relevance, status, vector, semanticUnverified);
    }

    public String displayTitle() {
        return englishTitle == null || englishTitle.isBlank() ? title : englishTitle;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }
}

package com.lexintel.service.query;

import com.lexintel.core.model.Article;
import com.lexintel.core.model.Category;
import com.lexintel.core.util.VectorMath;
import com.lexintel.service.embed.Embedder;
import com.lexintel.service.store.ArticleStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

public class ArticleSearch {
    public static final int MAX_LIMIT = 50;
    private static final Logger LOGGER = Logger.getLogger(ArticleSearch.class.getName());

    private final ArticleStore articleStore;
    private final Embedder embedder;
    private final Duration embedTimeout;

    public ArticleSearch(ArticleStore articleStore, Embedder embedder, Duration embedTimeout) {
        this.articleStore = articleStore;
        this.embedder = embedder;
        this.embedTimeout = embedTimeout;
    }

    public record Query(String text, Category category, int minRelevance, int limit, double minSimilarity) {
        public Query {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException("query text is required");
            }
            limit = Math.max(1, Math.min(limit, MAX_LIMIT));
            minRelevance = Math.max(1, minRelevance);
        }
    }

    public record Hit(Article article, Double similarity) {
    }

    public record Result(String query, boolean semantic, List<Hit> hits) {
        public Result {
            hits = List.copyOf(hits);
        }
    }

    public Result search(Query query) {
        Optional<double[]> vector = embedQuery(query.text());
        if (vector.isEmpty()) {
            return new Result(query.text(), false, titleMatches(query));
        }
        List<Hit> hits = new ArrayList<>();
        for (Article article : articleStore.all()) {
            if (!article.hasEmbedding() || !matchesFilters(article, query)) {
                continue;
            }
            double similarity = VectorMath.cosine(vector.get(), article.embedding());
            if (similarity >= query.minSimilarity()) {
                hits.add(new Hit(article, similarity));
            }
        }
        hits.sort(Comparator.comparingDouble((Hit hit) -> hit.similarity()).reversed());
        return new Result(query.text(), true, hits.subList(0, Math.min(query.limit(), hits.size())));
    }

    public Optional<Article> find(String id) {
        return articleStore.get(id).or(() -> articleStore.findBySourceId(id));
    }

    private List<Hit> titleMatches(Query query) {
        String needle = query.text().toLowerCase(Locale.ROOT).strip();
        return articleStore.all().stream()
                .filter(article -> matchesFilters(article, query))
                .filter(article -> article.displayTitle().toLowerCase(Locale.ROOT).contains(needle)
                        || article.title().toLowerCase(Locale.ROOT).contains(needle))
                .sorted(Comparator.comparing(Article::scrapedAt, Comparator.reverseOrder()))
                .limit(query.limit())
                .map(article -> new Hit(article, null))
                .toList();
    }

    private static boolean matchesFilters(Article article, Query query) {
        if (query.category() != null && article.category() != query.category()) {
            return false;
        }
        if (query.minRelevance() > 1) {
            return article.relevance() != null && article.relevance() >= query.minRelevance();
        }
        return true;
    }

    private Optional<double[]> embedQuery(String text) {
        try {
            return Optional.ofNullable(embedder.embed(text)
                    .orTimeout(embedTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join());
        } catch (CompletionException | CancellationException e) {
            LOGGER.warning("Query embedding unavailable, falling back to title match: " + e.getMessage());
            return Optional.empty();
        }
    }
}

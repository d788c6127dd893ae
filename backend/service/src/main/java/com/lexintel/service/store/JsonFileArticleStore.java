package com.lexintel.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lexintel.core.model.Article;
import com.lexintel.core.model.ArticleStatus;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

public class JsonFileArticleStore implements ArticleStore {
    private static final Comparator<Article> NEWEST_FIRST =
            Comparator.comparing(Article::scrapedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final JsonSnapshotFile<List<Article>> snapshot;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile Map<String, Article> articles;

    public JsonFileArticleStore(Path file) {
        this.snapshot = new JsonSnapshotFile<>(file, new TypeReference<>() {
        });
        List<Article> loaded = snapshot.load(List::of);
        Map<String, Article> byId = new LinkedHashMap<>();
        for (Article article : loaded) {
            byId.put(article.id(), article);
        }
        this.articles = byId;
    }

    @Override
    public void insert(Article article) {
        lock.lock();
        try {
            if (articles.containsKey(article.id())) {
                throw new IllegalStateException("Article id already stored: " + article.id());
            }
            Map<String, Article> next = new LinkedHashMap<>(articles);
            next.put(article.id(), article);
            commit(next);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Article> get(String id) {
        return Optional.ofNullable(articles.get(id));
    }

    @Override
    public Optional<Article> findBySourceId(String sourceId) {
        return articles.values().stream()
                .filter(article -> sourceId.equals(article.sourceId()))
                .findFirst();
    }

    @Override
    public Optional<Article> update(String id, UnaryOperator<Article> change) {
        lock.lock();
        try {
            Article current = articles.get(id);
            if (current == null) {
                return Optional.empty();
            }
            Article updated = change.apply(current);
            if (updated == current) {
                return Optional.of(current);
            }
            Map<String, Article> next = new LinkedHashMap<>(articles);
            next.put(id, updated);
            commit(next);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Article> pending(int limit) {
        return articles.values().stream()
                .filter(article -> article.status() == ArticleStatus.PENDING)
                .sorted(Comparator.comparing(Article::scrapedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public List<Article> scrapedSince(Instant since) {
        return articles.values().stream()
                .filter(article -> article.scrapedAt() != null && !article.scrapedAt().isBefore(since))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public List<Article> embeddedSince(Instant since, int limit) {
        return articles.values().stream()
                .filter(Article::hasEmbedding)
                .filter(article -> article.scrapedAt() != null && !article.scrapedAt().isBefore(since))
                .sorted(NEWEST_FIRST)
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public List<Article> all() {
        return List.copyOf(articles.values());
    }

    @Override
    public Map<ArticleStatus, Long> countByStatus() {
        Map<ArticleStatus, Long> counts = new EnumMap<>(ArticleStatus.class);
        for (ArticleStatus status : ArticleStatus.values()) {
            counts.put(status, 0L);
        }
        for (Article article : articles.values()) {
            counts.merge(article.status(), 1L, Long::sum);
        }
        return counts;
    }

    private void commit(Map<String, Article> next) {
        snapshot.write(new ArrayList<>(next.values()));
        articles = next;
    }
}

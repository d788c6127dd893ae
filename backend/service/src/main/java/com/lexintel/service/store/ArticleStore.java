package com.lexintel.service.store;

import com.lexintel.core.model.Article;
import com.lexintel.core.model.ArticleStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface ArticleStore {
    void insert(Article article);

    Optional<Article> get(String id);

    Optional<Article> findBySourceId(String sourceId);

    // Applies change to the stored article under the store lock. Returns the updated article, or empty if no article has that id.
    Optional<Article> update(String id, UnaryOperator<Article> change);

    List<Article> pending(int limit);

    List<Article> scrapedSince(Instant since);

    List<Article> embeddedSince(Instant since, int limit);

    List<Article> all();

    Map<ArticleStatus, Long> countByStatus();
}

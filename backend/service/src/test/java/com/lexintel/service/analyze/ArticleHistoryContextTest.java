package com.lexintel.service.analyze;

import com.lexintel.core.model.Article;
import com.lexintel.core.model.Category;
import com.lexintel.service.support.MutableClock;
import com.lexintel.service.support.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.lexintel.service.support.TestArticles.article;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArticleHistoryContextTest {
    private static final Instant NOW = Instant.parse("2026-03-10T06:00:00Z");

    private final MutableClock clock = new MutableClock(NOW, ZoneOffset.UTC);
    private TestStores stores;

    @BeforeEach
    void setUp() throws Exception {
        stores = TestStores.create();
    }

    @Test
    void embeddedArticlesPullNearestEarlierCoverage() {
        stores.articles.insert(article("Moonshot seed round").source("36kr").scrapedAt(NOW.minus(Duration.ofDays(5)))
                .embedding(1, 0).analyzed(Category.FUNDING, 4).build());
        stores.articles.insert(article("Unrelated robot story").scrapedAt(NOW.minus(Duration.ofDays(4)))
                .embedding(0, 1).analyzed(Category.PRODUCT, 5).build());
        stores.articles.insert(article("Too old").scrapedAt(NOW.minus(Duration.ofDays(40)))
                .embedding(1, 0).analyzed(Category.FUNDING, 5).build());
        Article current = article("Moonshot raises $1B").scrapedAt(NOW).embedding(0.9, 0.1)
                .analyzed(Category.FUNDING, 5).build();
        stores.articles.insert(current);

        String context = new ArticleHistoryContext(stores.articles, clock).contextFor(List.of(current));

        assertEquals("- [36kr] (2026-03-05, funding) Moonshot seed round", context);
    }

    @Test
    void withoutEmbeddingsUsesSameCategoryByRelevance() {
        stores.articles.insert(article("Low funding").scrapedAt(NOW.minus(Duration.ofDays(2)))
                .analyzed(Category.FUNDING, 2).build());
        stores.articles.insert(article("High funding").scrapedAt(NOW.minus(Duration.ofDays(3)))
                .analyzed(Category.FUNDING, 5).build());
        stores.articles.insert(article("Pending funding").scrapedAt(NOW.minus(Duration.ofDays(1))).build());
        Article current = article("New funding").scrapedAt(NOW).analyzed(Category.FUNDING, 4).build();

        String context = new ArticleHistoryContext(stores.articles, clock, Duration.ofDays(30), 1, 15, 0.5)
                .contextFor(List.of(current));

        assertTrue(context.contains("High funding"));
        assertFalse(context.contains("Low funding"));
        assertFalse(context.contains("Pending funding"));
    }

    @Test
    void emptyHistoryGivesEmptyContext() {
        Article current = article("Lonely").scrapedAt(NOW).analyzed(Category.OTHER, 3).build();

        assertEquals("", new ArticleHistoryContext(stores.articles, clock).contextFor(List.of(current)));
    }
}

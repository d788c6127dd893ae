package com.lexintel.service.analyze;

import com.lexintel.core.model.Article;
import com.lexintel.core.model.ArticleStatus;
import com.lexintel.core.util.VectorMath;
import com.lexintel.service.store.ArticleStore;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class ArticleHistoryContext implements HistoricalContextProvider {
    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private final ArticleStore articleStore;
    private final Clock clock;
    private final Duration lookback;
    private final int perArticle;
    private final int maxLines;
    private final double minSimilarity;

    public ArticleHistoryContext(ArticleStore articleStore, Clock clock) {
        this(articleStore, clock, Duration.ofDays(30), 3, 15, 0.5);
    }

    public ArticleHistoryContext(
            ArticleStore articleStore,
            Clock clock,
            Duration lookback,
            int perArticle,
            int maxLines,
            double minSimilarity
    ) {
        this.articleStore = articleStore;
        this.clock = clock;
        this.lookback = lookback;
        this.perArticle = perArticle;
        this.maxLines = maxLines;
        this.minSimilarity = minSimilarity;
    }

    @Override
    public String contextFor(List<Article> batch) {
        Set<String> batchIds = batch.stream().map(Article::id).collect(Collectors.toSet());
        List<Article> history = articleStore.scrapedSince(clock.instant().minus(lookback)).stream()
                .filter(article -> !batchIds.contains(article.id()))
                .filter(article -> article.status() != ArticleStatus.PENDING && article.category() != null)
                .toList();
        if (history.isEmpty()) {
            return "";
        }

        Map<String, Article> related = new LinkedHashMap<>();
        for (Article article : batch) {
            for (Article match : neighbours(article, history)) {
                related.putIfAbsent(match.id(), match);
            }
            if (related.size() >= maxLines) {
                break;
            }
        }
        return related.values().stream()
                .limit(maxLines)
                .map(ArticleHistoryContext::format)
                .collect(Collectors.joining("\n"));
    }

    private List<Article> neighbours(Article article, List<Article> history) {
        if (article.hasEmbedding()) {
            return history.stream()
                    .filter(Article::hasEmbedding)
                    .filter(candidate -> VectorMath.cosine(article.embedding(), candidate.embedding()) >= minSimilarity)
                    .sorted(Comparator.comparingDouble(
                            (Article candidate) -> VectorMath.cosine(article.embedding(), candidate.embedding())).reversed())
                    .limit(perArticle)
                    .toList();
        }
        return history.stream()
                .filter(candidate -> candidate.category() == article.category())
                .sorted(Comparator.comparing((Article candidate) -> candidate.relevance() == null ? 0 : candidate.relevance())
                        .reversed())
                .limit(perArticle)
                .toList();
    }

    private static String format(Article article) {
        return "- [" + article.source() + "] (" + DAY.format(article.publishedAt()) + ", "
                + article.category().wireName() + ") " + article.displayTitle();
    }
}

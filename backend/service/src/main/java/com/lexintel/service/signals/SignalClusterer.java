package com.lexintel.service.signals;

import com.lexintel.core.model.Article;
import com.lexintel.core.model.Category;
import com.lexintel.core.model.SignalThread;
import com.lexintel.core.model.ThreadMember;
import com.lexintel.core.util.VectorMath;
import com.lexintel.service.config.PipelineConfig;
import com.lexintel.service.store.ArticleStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups recent high-relevance articles into signal threads. Articles with embeddings
 * join the same-category thread whose running centroid is most similar, at or above the
 * cluster threshold. Articles without embeddings join a same-category thread sharing at
 * least two title keywords.
 */
public class SignalClusterer {
    static final int THEME_CHARS = 80;
    static final int MIN_SHARED_KEYWORDS = 2;
    static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "in", "of", "to", "for", "and", "is", "on",
            "at", "by", "with", "from", "its", "has", "new", "china", "chinese",
            "ai", "says", "will", "than", "more", "about", "into", "over"
    );
    private static final Pattern WORD = Pattern.compile("[a-z]{3,}");

    static final Comparator<SignalThread> THREAD_ORDER = Comparator
            .comparingInt((SignalThread thread) -> thread.confidence().rank()).reversed()
            .thenComparing(Comparator.comparingInt((SignalThread thread) -> thread.members().size()).reversed())
            .thenComparing(Comparator.comparingInt(SignalThread::maxRelevance).reversed());

    private final ArticleStore articleStore;
    private final PipelineConfig.Signals config;
    private final Clock clock;

    public SignalClusterer(ArticleStore articleStore, PipelineConfig.Signals config, Clock clock) {
        this.articleStore = articleStore;
        this.config = config;
        this.clock = clock;
    }

    public int clampDays(int days) {
        return Math.max(1, Math.min(days, config.maxDays()));
    }

    public List<SignalThread> threads(int days, int minRelevance) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(clampDays(days)));
        List<Article> candidates = articleStore.scrapedSince(cutoff).stream()
                .filter(article -> article.category() != null && article.relevance() != null)
                .filter(article -> article.relevance() >= minRelevance)
                .sorted(Comparator.comparing((Article article) -> article.relevance()).reversed()
                        .thenComparing(Article::scrapedAt, Comparator.reverseOrder()))
                .toList();
        return cluster(candidates);
    }

    // Clusters the given articles in order. The first article of a thread fixes its theme.
    public List<SignalThread> cluster(List<Article> articles) {
        List<Builder> builders = new ArrayList<>();
        for (Article article : articles) {
            Builder target = article.hasEmbedding() ? nearestByCentroid(builders, article) : byKeywords(builders, article);
            if (target == null) {
                target = new Builder(article.category());
                builders.add(target);
            }
            target.add(article);
        }
        List<SignalThread> threads = new ArrayList<>();
        for (Builder builder : builders) {
            threads.add(builder.build());
        }
        threads.sort(THREAD_ORDER);
        return threads;
    }

    private Builder nearestByCentroid(List<Builder> builders, Article article) {
        Builder best = null;
        double bestSimilarity = Double.NEGATIVE_INFINITY;
        for (Builder builder : builders) {
            if (builder.category != article.category() || builder.centroid == null) {
                continue;
            }
            double similarity = VectorMath.cosine(builder.centroid, article.embedding());
            if (similarity >= config.clusterThreshold() && similarity > bestSimilarity) {
                best = builder;
                bestSimilarity = similarity;
            }
        }
        return best;
    }

    private static Builder byKeywords(List<Builder> builders, Article article) {
        Set<String> keywords = keywords(article.displayTitle());
        for (Builder builder : builders) {
            if (builder.category != article.category()) {
                continue;
            }
            int shared = 0;
            for (String keyword : keywords) {
                if (builder.keywords.contains(keyword)) {
                    shared++;
                }
            }
            if (shared >= MIN_SHARED_KEYWORDS) {
                return builder;
            }
        }
        return null;
    }

    static Set<String> keywords(String title) {
        Set<String> words = new HashSet<>();
        if (title == null) {
            return words;
        }
        Matcher matcher = WORD.matcher(title.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String word = matcher.group();
            if (!STOPWORDS.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }

    private static final class Builder {
        private final Category category;
        private final List<ThreadMember> members = new ArrayList<>();
        private final Set<String> keywords = new HashSet<>();
        private double[] centroid;
        private int embedded;
        private String theme;

        private Builder(Category category) {
            this.category = category;
        }

        private void add(Article article) {
            String title = article.displayTitle();
            if (theme == null) {
                theme = title.length() <= THEME_CHARS ? title : title.substring(0, THEME_CHARS);
            }
            members.add(new ThreadMember(article.id(), article.source(), title, article.relevance(),
                    article.publishedAt()));
            keywords.addAll(keywords(title));
            if (article.hasEmbedding()) {
                centroid = VectorMath.foldIntoCentroid(centroid, embedded, article.embedding());
                embedded++;
            }
        }

        private SignalThread build() {
            return new SignalThread(theme, category, members);
        }
    }
}

package com.lexintel.service.ingest;

import com.lexintel.core.model.Article;
import com.lexintel.core.util.VectorMath;
import com.lexintel.service.config.PipelineConfig;
import com.lexintel.service.embed.Embedder;
import com.lexintel.service.embed.EmbeddingException;
import com.lexintel.service.store.ArticleStore;
import com.lexintel.service.store.DedupTitleStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

public class Deduplicator {
    private static final Logger LOGGER = Logger.getLogger(Deduplicator.class.getName());

    private final ArticleStore articleStore;
    private final DedupTitleStore titleStore;
    private final DedupWindow window;
    private final Embedder embedder;
    private final PipelineConfig.Dedup settings;
    private final Clock clock;

    public Deduplicator(
            ArticleStore articleStore,
            DedupTitleStore titleStore,
            Embedder embedder,
            PipelineConfig.Dedup settings,
            Clock clock
    ) {
        this.articleStore = articleStore;
        this.titleStore = titleStore;
        this.embedder = embedder;
        this.settings = settings;
        this.clock = clock;
        this.window = new DedupWindow(settings.windowSize(), Duration.ofDays(settings.maxAgeDays()));
        warmWindow();
    }

    /**
     * Called sequentially by one scrape run; concurrent callers would race between the
     * exact check and the insert.
     */
    public synchronized DedupResult accept(Article candidate) {
        Instant now = clock.instant();
        String titleNorm = candidate.titleNorm();
        if (window.contains(titleNorm, now) || titleStore.seenSince(titleNorm, maxAgeCutoff(now))) {
            return new DedupResult(DedupVerdict.REJECTED_EXACT, candidate, Double.NaN, null);
        }

        double[] embedding = embedOrNull(candidate);
        double best = Double.NaN;
        String nearest = null;
        if (embedding != null) {
            Instant lookback = now.minus(Duration.ofDays(settings.semanticLookbackDays()));
            List<Article> neighbours = articleStore.embeddedSince(lookback, settings.semanticCandidateLimit());
            for (Article neighbour : neighbours) {
                double similarity = VectorMath.cosine(embedding, neighbour.embedding());
                if (Double.isNaN(best) || similarity > best) {
                    best = similarity;
                    nearest = neighbour.id();
                }
            }
            if (!Double.isNaN(best) && best >= settings.semanticThreshold()) {
                return new DedupResult(DedupVerdict.REJECTED_SEMANTIC, candidate, best, nearest);
            }
        }

        Article accepted = embedding != null
                ? candidate.withEmbedding(embedding)
                : unverified(candidate);
        articleStore.insert(accepted);
        titleStore.add(new DedupTitleStore.DedupTitle(titleNorm, candidate.source(), now));
        window.add(titleNorm, now);
        return new DedupResult(DedupVerdict.ACCEPTED, accepted, best, null);
    }

    public int windowSize() {
        return window.size();
    }

    private double[] embedOrNull(Article candidate) {
        String text = Embedder.embeddingText(candidate.title(), candidate.body());
        try {
            double[] vector = embedder.embed(text)
                    .orTimeout(settings.embedTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .join();
            if (vector == null || vector.length == 0) {
                LOGGER.warning("Embedder returned an empty vector for " + candidate.source() + "; accepting unverified");
                return null;
            }
            return vector;
        } catch (CompletionException | CancellationException | EmbeddingException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOGGER.warning("Embedding unavailable for " + candidate.source() + " (" + cause + "); accepting unverified");
            return null;
        }
    }

    private static Article unverified(Article candidate) {
        return new Article(candidate.id(), candidate.source(), candidate.sourceId(), candidate.title(),
                candidate.titleNorm(), candidate.url(), candidate.body(), candidate.publishedAt(),
                candidate.scrapedAt(), candidate.englishTitle(), candidate.category(), candidate.relevance(),
                candidate.status(), null, true);
    }

    private Instant maxAgeCutoff(Instant now) {
        return now.minus(Duration.ofDays(settings.maxAgeDays()));
    }

    private void warmWindow() {
        List<DedupTitleStore.DedupTitle> recent = titleStore.seenSince(maxAgeCutoff(clock.instant()));
        int skip = Math.max(0, recent.size() - settings.windowSize());
        for (DedupTitleStore.DedupTitle title : recent.subList(skip, recent.size())) {
            window.add(title.titleNorm(), title.seenAt());
        }
        LOGGER.fine(() -> "Dedup window warmed with " + window.size() + " titles");
    }
}

package com.lexintel.service.runtime;

import com.lexintel.core.model.Article;
import com.lexintel.core.model.ArticleStatus;
import com.lexintel.service.config.PipelineConfig;
import com.lexintel.service.store.ArticleStore;
import com.lexintel.service.store.DedupTitleStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

public class MaintenanceCycle implements Cycle {
    public static final String NAME = "maintenance";
    private static final Logger LOGGER = Logger.getLogger(MaintenanceCycle.class.getName());

    private final ArticleStore articleStore;
    private final DedupTitleStore titleStore;
    private final PipelineConfig config;
    private final Clock clock;

    public MaintenanceCycle(ArticleStore articleStore, DedupTitleStore titleStore, PipelineConfig config, Clock clock) {
        this.articleStore = articleStore;
        this.titleStore = titleStore;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CycleResult run() {
        Instant now = clock.instant();
        try {
            int pruned = titleStore.pruneBefore(now.minus(Duration.ofDays(config.dedup().maxAgeDays())));
            int archived = archiveBefore(now.minus(Duration.ofDays(config.maintenance().archiveAfterDays())));
            LOGGER.info("Maintenance: pruned " + pruned + " dedup titles, archived " + archived + " articles");
            return CycleResult.success(NAME, "Pruned " + pruned + " titles, archived " + archived + " articles",
                    Map.of("prunedTitles", pruned, "archivedArticles", archived));
        } catch (IllegalStateException storageError) {
            LOGGER.log(Level.SEVERE, "Maintenance aborted", storageError);
            return CycleResult.failure(NAME, "Maintenance failed: " + storageError.getMessage(), Map.of());
        }
    }

    int archiveBefore(Instant cutoff) {
        int archived = 0;
        for (Article article : articleStore.all()) {
            if (!archivable(article, cutoff)) {
                continue;
            }
            if (articleStore.update(article.id(), current -> archivable(current, cutoff)
                    ? current.advanceTo(ArticleStatus.ARCHIVED)
                    : current).filter(updated -> updated.status() == ArticleStatus.ARCHIVED).isPresent()) {
                archived++;
            }
        }
        return archived;
    }

    private static boolean archivable(Article article, Instant cutoff) {
        boolean settled = article.status() == ArticleStatus.ANALYZED || article.status() == ArticleStatus.PUBLISHED;
        return settled && article.scrapedAt() != null && article.scrapedAt().isBefore(cutoff);
    }
}

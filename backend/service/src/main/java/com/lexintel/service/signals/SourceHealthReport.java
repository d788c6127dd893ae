package com.lexintel.service.signals;

import com.lexintel.core.model.Article;
import com.lexintel.core.model.RunMode;
import com.lexintel.core.model.ScrapeRun;
import com.lexintel.core.model.SourceHealth;
import com.lexintel.service.store.ArticleStore;
import com.lexintel.service.store.RunStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class SourceHealthReport {
    public static final int HIGH_RELEVANCE = 4;

    private final ArticleStore articleStore;
    private final RunStore runStore;
    private final Clock clock;

    public SourceHealthReport(ArticleStore articleStore, RunStore runStore, Clock clock) {
        this.articleStore = articleStore;
        this.runStore = runStore;
        this.clock = clock;
    }

    public List<SourceHealth> report(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(Math.max(1, days)));
        Map<String, int[]> counts = new HashMap<>();
        for (Article article : articleStore.scrapedSince(cutoff)) {
            int[] tally = counts.computeIfAbsent(article.source(), ignored -> new int[2]);
            tally[0]++;
            if (article.relevance() != null && article.relevance() >= HIGH_RELEVANCE) {
                tally[1]++;
            }
        }

        Map<String, Instant> lastSuccess = new HashMap<>();
        Map<String, Instant> lastFailure = new HashMap<>();
        Set<String> seen = new LinkedHashSet<>(counts.keySet());
        for (ScrapeRun run : runStore.scrapeRuns()) {
            if (run.mode() != RunMode.SCRAPE && run.mode() != RunMode.FULL_CYCLE) {
                continue;
            }
            Instant at = run.finishedAt() != null ? run.finishedAt() : run.startedAt();
            for (String source : run.sourcesOk()) {
                lastSuccess.putIfAbsent(source, at);
                seen.add(source);
            }
            for (String source : run.sourcesFailed()) {
                lastFailure.putIfAbsent(source, at);
                seen.add(source);
            }
        }

        List<SourceHealth> report = new ArrayList<>();
        for (String source : seen) {
            int[] tally = counts.getOrDefault(source, new int[2]);
            double pct = tally[0] == 0 ? 0.0 : Math.round(1000.0 * tally[1] / tally[0]) / 10.0;
            report.add(new SourceHealth(source, tally[0], tally[1], pct,
                    lastSuccess.get(source), lastFailure.get(source)));
        }
        report.sort(Comparator.comparingInt(SourceHealth::total).reversed().thenComparing(SourceHealth::source));
        return report;
    }
}

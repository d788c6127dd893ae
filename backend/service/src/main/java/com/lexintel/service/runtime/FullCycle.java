package com.lexintel.service.runtime;

import com.lexintel.core.model.AnalysisRun;
import com.lexintel.core.model.RunMode;
import com.lexintel.core.model.ScrapeRun;
import com.lexintel.service.analyze.AnalyzeCycle;
import com.lexintel.service.ingest.ScrapeCycle;
import com.lexintel.service.publish.DrainReport;
import com.lexintel.service.publish.PublishQueueManager;
import com.lexintel.service.store.RunStore;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

public class FullCycle implements Cycle {
    public static final String NAME = "cycle";
    private static final Logger LOGGER = Logger.getLogger(FullCycle.class.getName());

    private final ScrapeCycle scrape;
    private final AnalyzeCycle analyze;
    private final PublishQueueManager queue;
    private final RunStore runStore;
    private final Clock clock;

    public FullCycle(ScrapeCycle scrape, AnalyzeCycle analyze, PublishQueueManager queue, RunStore runStore, Clock clock) {
        this.scrape = scrape;
        this.analyze = analyze;
        this.queue = queue;
        this.runStore = runStore;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CycleResult run() {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("runId", runId);

        ScrapeRun scraped = scrape.scrape();
        stats.put("scrapeRunId", scraped.id());
        stats.put("articlesFound", scraped.articlesFound());
        stats.put("articlesNew", scraped.articlesNew());
        if (!scraped.succeeded()) {
            record(new ScrapeRun(runId, RunMode.FULL_CYCLE, startedAt, clock.instant(), 0, 0, 0, 0, 0,
                    scraped.sourcesOk(), scraped.sourcesFailed(), scraped.error()));
            return CycleResult.failure(NAME, "Scrape failed: " + scraped.error(), stats);
        }
        if (scraped.articlesNew() == 0) {
            stats.put("skipped", "analyze,publish");
            record(summary(runId, startedAt, scraped, null));
            return CycleResult.success(NAME, "No new articles, analysis and publishing skipped", stats);
        }

        AnalysisRun analysis = analyze.analyze();
        stats.put("analysisRunId", analysis.id());
        stats.put("briefingId", analysis.briefingId() == null ? "" : analysis.briefingId());
        stats.put("postsQueued", analysis.postsQueued());

        String error = analysis.error();
        try {
            DrainReport drain = queue.drain();
            stats.put("published", drain.published());
            stats.put("failed", drain.failed());
        } catch (IllegalStateException storageError) {
            LOGGER.log(Level.SEVERE, "Publish step of cycle " + runId + " aborted", storageError);
            error = "Publish failed: " + storageError.getMessage();
        }
        record(summary(runId, startedAt, scraped, error));
        if (error != null) {
            return CycleResult.failure(NAME, "Cycle completed with errors: " + error, stats);
        }
        return CycleResult.success(NAME, "Cycle complete: " + scraped.articlesNew() + " new, "
                + analysis.postsQueued() + " posts queued", stats);
    }

    private ScrapeRun summary(String runId, Instant startedAt, ScrapeRun scraped, String error) {
        return new ScrapeRun(runId, RunMode.FULL_CYCLE, startedAt, clock.instant(), scraped.articlesFound(),
                scraped.articlesNew(), scraped.rejectedExact(), scraped.rejectedSemantic(),
                scraped.unverifiedSemantic(), scraped.sourcesOk(), scraped.sourcesFailed(), error);
    }

    private void record(ScrapeRun run) {
        try {
            runStore.saveScrapeRun(run);
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "Unable to record full cycle run " + run.id(), e);
        }
    }
}

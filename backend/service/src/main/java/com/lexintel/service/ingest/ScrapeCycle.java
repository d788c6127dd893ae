package com.lexintel.service.ingest;

import com.lexintel.collectors.api.FetchContext;
import com.lexintel.collectors.api.FetchResult;
import com.lexintel.collectors.api.SourceFetcher;
import com.lexintel.core.bus.EventBus;
import com.lexintel.core.events.AlertRaised;
import com.lexintel.core.events.ArticlesIngested;
import com.lexintel.core.model.Article;
import com.lexintel.core.model.RawRecord;
import com.lexintel.core.model.RunMode;
import com.lexintel.core.model.ScrapeRun;
import com.lexintel.service.runtime.Cycle;
import com.lexintel.service.runtime.CycleResult;
import com.lexintel.service.store.RunStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ScrapeCycle implements Cycle {
    public static final String NAME = "scrape";
    private static final Logger LOGGER = Logger.getLogger(ScrapeCycle.class.getName());

    private final List<SourceFetcher> fetchers;
    private final FetchContext fetchContext;
    private final Normalizer normalizer;
    private final Deduplicator deduplicator;
    private final RunStore runStore;
    private final EventBus eventBus;
    private final Clock clock;

    public ScrapeCycle(
            List<SourceFetcher> fetchers,
            FetchContext fetchContext,
            Normalizer normalizer,
            Deduplicator deduplicator,
            RunStore runStore,
            EventBus eventBus,
            Clock clock
    ) {
        this.fetchers = List.copyOf(fetchers);
        this.fetchContext = fetchContext;
        this.normalizer = normalizer;
        this.deduplicator = deduplicator;
        this.runStore = runStore;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CycleResult run() {
        ScrapeRun run = scrape();
        Map<String, Object> stats = Map.of(
                "runId", run.id(),
                "articlesFound", run.articlesFound(),
                "articlesNew", run.articlesNew(),
                "rejectedExact", run.rejectedExact(),
                "rejectedSemantic", run.rejectedSemantic(),
                "sourcesOk", run.sourcesOk(),
                "sourcesFailed", run.sourcesFailed()
        );
        if (!run.succeeded()) {
            return CycleResult.failure(NAME, "Scrape failed: " + run.error(), stats);
        }
        return CycleResult.success(NAME, "Scraped " + run.articlesNew() + " new articles", stats);
    }

    public ScrapeRun scrape() {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        try {
            List<FetchResult> results = fetchAll();
            Tally tally = new Tally();
            for (FetchResult result : results) {
                if (result instanceof FetchResult.Ok ok) {
                    ingest(ok, tally);
                } else {
                    FetchResult.Err err = (FetchResult.Err) result;
                    tally.sourcesFailed.add(err.source());
                    LOGGER.warning("Source " + err.source() + " failed: " + err.message());
                    eventBus.publish(new AlertRaised(
                            clock.instant(),
                            "source",
                            "Source fetch failed for " + err.source() + ": " + err.message(),
                            Map.of("source", err.source(), "runId", runId)
                    ));
                }
            }
            ScrapeRun run = new ScrapeRun(runId, RunMode.SCRAPE, startedAt, clock.instant(),
                    tally.found, tally.accepted, tally.rejectedExact, tally.rejectedSemantic, tally.unverified,
                    tally.sourcesOk, tally.sourcesFailed, null);
            runStore.saveScrapeRun(run);
            LOGGER.info("Scrape " + runId + ": " + run.articlesFound() + " found, " + run.articlesNew() + " new, "
                    + run.sourcesFailed().size() + "/" + fetchers.size() + " sources failed");
            return run;
        } catch (IllegalStateException storageError) {
            LOGGER.log(Level.SEVERE, "Scrape " + runId + " aborted", storageError);
            String reason = storageError.getMessage() != null ? storageError.getMessage() : storageError.toString();
            ScrapeRun failed = ScrapeRun.failed(runId, RunMode.SCRAPE, startedAt, clock.instant(), reason);
            recordFailure(failed);
            return failed;
        }
    }

    private List<FetchResult> fetchAll() {
        long budgetMillis = fetchContext.requestTimeout().toMillis() * 2;
        List<CompletableFuture<FetchResult>> tasks = new ArrayList<>();
        for (SourceFetcher fetcher : fetchers) {
            tasks.add(startFetch(fetcher)
                    .orTimeout(budgetMillis, TimeUnit.MILLISECONDS)
                    .handle((result, error) -> error == null
                            ? result
                            : FetchResult.err(fetcher.name(), "Fetch did not complete: " + rootMessage(error))));
        }
        CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();
        return tasks.stream().map(CompletableFuture::join).toList();
    }

    private CompletableFuture<FetchResult> startFetch(SourceFetcher fetcher) {
        try {
            return fetcher.fetch(fetchContext);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void ingest(FetchResult.Ok ok, Tally tally) {
        tally.sourcesOk.add(ok.source());
        int accepted = 0;
        for (RawRecord record : ok.records()) {
            tally.found++;
            Optional<Article> candidate = normalizer.normalize(record);
            if (candidate.isEmpty()) {
                LOGGER.fine(() -> "Dropping record with empty normalized title from " + ok.source());
                continue;
            }
            DedupResult result = deduplicator.accept(candidate.get());
            if (result.accepted()) {
                accepted++;
                tally.accepted++;
                if (result.unverified()) {
                    tally.unverified++;
                }
            } else if (result.verdict() == DedupVerdict.REJECTED_EXACT) {
                tally.rejectedExact++;
            } else {
                tally.rejectedSemantic++;
            }
        }
        eventBus.publish(new ArticlesIngested(clock.instant(), ok.source(), ok.records().size(), accepted));
    }

    private void recordFailure(ScrapeRun failed) {
        eventBus.publish(new AlertRaised(
                clock.instant(),
                "cycle",
                "Scrape aborted: " + failed.error(),
                Map.of("cycle", NAME, "runId", failed.id())
        ));
        try {
            runStore.saveScrapeRun(failed);
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "Unable to record failed scrape run " + failed.id(), e);
        }
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }

    private static final class Tally {
        private int found;
        private int accepted;
        private int rejectedExact;
        private int rejectedSemantic;
        private int unverified;
        private final List<String> sourcesOk = new ArrayList<>();
        private final List<String> sourcesFailed = new ArrayList<>();
    }
}

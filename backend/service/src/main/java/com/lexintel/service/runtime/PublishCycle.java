package com.lexintel.service.runtime;

import com.lexintel.core.bus.EventBus;
import com.lexintel.core.events.AlertRaised;
import com.lexintel.core.model.RunMode;
import com.lexintel.core.model.ScrapeRun;
import com.lexintel.service.publish.DrainReport;
import com.lexintel.service.publish.PublishQueueManager;
import com.lexintel.service.store.RunStore;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

public class PublishCycle implements Cycle {
    public static final String NAME = "publish";
    private static final Logger LOGGER = Logger.getLogger(PublishCycle.class.getName());

    private final PublishQueueManager queue;
    private final RunStore runStore;
    private final EventBus eventBus;
    private final Clock clock;

    public PublishCycle(PublishQueueManager queue, RunStore runStore, EventBus eventBus, Clock clock) {
        this.queue = queue;
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
        return run(Map.of());
    }

    // Accepts platform to drain a single platform's items.
    @Override
    public CycleResult run(Map<String, String> options) {
        Optional<String> platform = Optional.ofNullable(options.get("platform")).map(String::trim)
                .filter(value -> !value.isEmpty());
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        try {
            DrainReport report = queue.drain(platform);
            if (report.attempted() > 0 || report.reclaimed() > 0) {
                runStore.saveScrapeRun(new ScrapeRun(runId, RunMode.PUBLISH, startedAt, clock.instant(),
                        report.attempted(), report.published(), 0, 0, 0, List.of(), List.of(), null));
            }
            String message = "Published " + report.published() + ", retry queued " + report.retryQueued()
                    + ", failed " + report.failed() + (report.interrupted() ? " (interrupted)" : "");
            Map<String, Object> stats = stats(report);
            platform.ifPresent(value -> stats.put("platform", value));
            return CycleResult.success(NAME, message, stats);
        } catch (IllegalStateException storageError) {
            LOGGER.log(Level.SEVERE, "Publish drain " + runId + " aborted", storageError);
            String reason = storageError.getMessage() != null ? storageError.getMessage() : storageError.toString();
            eventBus.publish(new AlertRaised(clock.instant(), "cycle", "Publish aborted: " + reason,
                    Map.of("cycle", NAME, "runId", runId)));
            try {
                runStore.saveScrapeRun(ScrapeRun.failed(runId, RunMode.PUBLISH, startedAt, clock.instant(), reason));
            } catch (IllegalStateException e) {
                LOGGER.log(Level.SEVERE, "Unable to record failed publish run " + runId, e);
            }
            return CycleResult.failure(NAME, "Publish failed: " + reason, Map.of("runId", runId));
        }
    }

    static Map<String, Object> stats(DrainReport report) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("reclaimed", report.reclaimed());
        stats.put("attempted", report.attempted());
        stats.put("published", report.published());
        stats.put("publishedViaFallback", report.publishedViaFallback());
        stats.put("retryQueued", report.retryQueued());
        stats.put("failed", report.failed());
        stats.put("conflicts", report.conflicts());
        stats.put("skipped", report.skippedNoAdapter());
        stats.put("interrupted", report.interrupted());
        return stats;
    }
}

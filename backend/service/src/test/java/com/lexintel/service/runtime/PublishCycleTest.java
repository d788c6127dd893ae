package com.lexintel.service.runtime;

import com.lexintel.core.bus.EventBus;
import com.lexintel.core.model.PublishStatus;
import com.lexintel.core.model.RunMode;
import com.lexintel.core.model.ScrapeRun;
import com.lexintel.core.model.Urgency;
import com.lexintel.service.config.PipelineConfig;
import com.lexintel.service.publish.PublishOutcome;
import com.lexintel.service.publish.PublishQueueManager;
import com.lexintel.service.support.MutableClock;
import com.lexintel.service.support.ScriptedAdapter;
import com.lexintel.service.support.TestStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PublishCycleTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T08:00:00Z"), ZoneOffset.UTC);
    private final EventBus bus = new EventBus();
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final ScriptedAdapter devto = new ScriptedAdapter("devto");
    private TestStores stores;
    private PublishQueueManager queue;

    @BeforeEach
    void setUp() throws Exception {
        stores = TestStores.create();
        queue = new PublishQueueManager(stores.queue, stores.articles, Map.of("devto", devto),
                PipelineConfig.Publish.defaults(), bus, clock, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void idleDrainLeavesNoRunRecord() {
        CycleResult result = new PublishCycle(queue, stores.runs, bus, clock).run();

        assertTrue(result.success());
        assertEquals(0, result.stats().get("attempted"));
        assertTrue(stores.runs.scrapeRuns().isEmpty());
    }

    @Test
    void drainThatPublishesIsRecordedAsPublishRun() {
        devto.then(PublishOutcome.transientFailure("HTTP 503"));
        queue.enqueue("devto", "a1", "b1", "First", "Body one", null, Urgency.HIGH, 3);
        queue.enqueue("devto", "a2", "b1", "Second", "Body two", null, Urgency.LOW, 3);

        CycleResult result = new PublishCycle(queue, stores.runs, bus, clock).run();

        assertTrue(result.success());
        assertEquals(2, result.stats().get("attempted"));
        assertEquals(1, result.stats().get("published"));
        assertEquals(1, result.stats().get("retryQueued"));
        assertEquals("Published 1, retry queued 1, failed 0", result.message());

        ScrapeRun run = stores.runs.latestScrapeRun().orElseThrow();
        assertEquals(RunMode.PUBLISH, run.mode());
        assertEquals(2, run.articlesFound());
        assertEquals(1, run.articlesNew());
        assertEquals(1L, stores.queue.countByStatus().get(PublishStatus.RETRY_QUEUED));
    }

    @Test
    void platformOptionDrainsOnlyThatPlatform() {
        queue.enqueue("devto", "a1", "b1", "First", "Body one", null, Urgency.HIGH, 3);

        CycleResult result = new PublishCycle(queue, stores.runs, bus, clock).run(Map.of("platform", " hashnode "));

        assertTrue(result.success());
        assertEquals("hashnode", result.stats().get("platform"));
        assertEquals(0, result.stats().get("attempted"));
        assertEquals(0, devto.calls());
        assertEquals(1L, stores.queue.countByStatus().get(PublishStatus.QUEUED));
        assertTrue(stores.runs.scrapeRuns().isEmpty());
    }
}

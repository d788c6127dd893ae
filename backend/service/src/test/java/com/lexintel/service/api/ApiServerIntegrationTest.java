package com.lexintel.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexintel.core.bus.EventBus;
import com.lexintel.core.events.AlertRaised;
import com.lexintel.core.events.CycleStarted;
import com.lexintel.core.model.Briefing;
import com.lexintel.core.model.BriefingSections;
import com.lexintel.core.model.Category;
import com.lexintel.core.model.PublishQueueItem;
import com.lexintel.core.model.Urgency;
import com.lexintel.core.util.JsonUtils;
import com.lexintel.service.config.PipelineConfig;
import com.lexintel.service.publish.PublishQueueManager;
import com.lexintel.service.query.ArticleSearch;
import com.lexintel.service.query.StatusService;
import com.lexintel.service.runtime.Cycle;
import com.lexintel.service.runtime.CycleResult;
import com.lexintel.service.runtime.SchedulerService;
import com.lexintel.service.signals.MomentumCalculator;
import com.lexintel.service.signals.SignalClusterer;
import com.lexintel.service.signals.SourceHealthReport;
import com.lexintel.service.store.EventCodec;
import com.lexintel.service.store.JsonlEventStore;
import com.lexintel.service.support.FakeEmbedder;
import com.lexintel.service.support.TestStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static com.lexintel.service.support.TestArticles.article;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiServerIntegrationTest {
    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    private final HttpClient client = HttpClient.newHttpClient();
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final CountDownLatch scrapeEntered = new CountDownLatch(1);
    private final CountDownLatch scrapeRelease = new CountDownLatch(1);
    private TestStores stores;
    private EventBus eventBus;
    private PublishQueueManager queue;
    private ApiServer apiServer;
    private final Map<String, Map<String, String>> receivedOptions = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws Exception {
        stores = TestStores.create();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        JsonlEventStore eventStore = new JsonlEventStore(stores.dir.resolve("logs/events.jsonl"));
        eventBus = new EventBus((event, error) -> {
            throw new AssertionError("EventBus handler error", error);
        });
        EventCodec.subscribeAll(eventBus, eventStore::append);

        FakeEmbedder embedder = new FakeEmbedder();
        embedder.setDown(true);
        SourceHealthReport sourceHealth = new SourceHealthReport(stores.articles, stores.runs, clock);
        QueryServices queries = new QueryServices(
                new ArticleSearch(stores.articles, embedder, Duration.ofSeconds(1)),
                stores.runs,
                new SignalClusterer(stores.articles, PipelineConfig.Signals.defaults(), clock),
                new MomentumCalculator(stores.articles, clock),
                sourceHealth,
                new StatusService(stores.articles, stores.queue, stores.runs, sourceHealth, clock),
                eventStore,
                4
        );
        queue = new PublishQueueManager(stores.queue, stores.articles, Map.of(), PipelineConfig.Publish.defaults(),
                eventBus, clock, executor);
        SchedulerService scheduler = new SchedulerService(
                List.of(
                        new SchedulerService.ScheduledCycle(cycle("publish", () ->
                                CycleResult.success("publish", "Published 0", Map.of("published", 0))),
                                Duration.ofMinutes(15), true),
                        new SchedulerService.ScheduledCycle(cycle("scrape", () -> {
                            scrapeEntered.countDown();
                            try {
                                scrapeRelease.await(5, TimeUnit.SECONDS);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                            return CycleResult.success("scrape", "Scraped 0 new articles", Map.of());
                        }), Duration.ofHours(24), true),
                        new SchedulerService.ScheduledCycle(cycle("analyze", () ->
                                CycleResult.failure("analyze", "Synthesis failed", Map.of())),
                                Duration.ofHours(24), true)
                ),
                eventBus,
                clock
        );
        apiServer = new ApiServer(0, queries, scheduler, queue, new DiagnosticsTracker(eventBus, clock));
        apiServer.start();
    }

    @AfterEach
    void tearDown() {
        scrapeRelease.countDown();
        apiServer.stop();
        executor.shutdownNow();
    }

    @Test
    void healthEndpointReturnsOk() throws Exception {
        HttpResponse<String> response = get("/api/health");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("\"status\":\"ok\""));
    }

    @Test
    void searchFallsBackToTitlesAndValidatesParams() throws Exception {
        stores.articles.insert(article("Huawei chip yields improve").id("a1").analyzed(Category.PRODUCT, 4).build());
        stores.articles.insert(article("Moonshot raises 1B").id("a2").analyzed(Category.FUNDING, 5).build());

        JsonNode body = json(get("/api/articles/search?q=chip&limit=5"));
        assertFalse(body.get("semantic").asBoolean());
        assertEquals(1, body.get("total").asInt());
        assertEquals("a1", body.get("articles").get(0).get("id").asText());
        assertEquals("product", body.get("articles").get(0).get("category").asText());

        assertEquals(400, get("/api/articles/search").statusCode());
        assertEquals(400, get("/api/articles/search?q=chip&category=gossip").statusCode());
        assertEquals(400, get("/api/articles/search?q=chip&limit=many").statusCode());
    }

    @Test
    void articleDetailByIdOrSourceId() throws Exception {
        stores.articles.insert(article("Kimi doubles context").id("k1").body("Full text").build());

        JsonNode byId = json(get("/api/articles/k1"));
        assertEquals("Full text", byId.get("body").asText());
        assertEquals("pending", byId.get("status").asText());
        assertEquals("k1", json(get("/api/articles/36kr:k1")).get("id").asText());
        assertEquals(404, get("/api/articles/missing").statusCode());
    }

    @Test
    void briefingsEndpoints() throws Exception {
        assertEquals(404, get("/api/briefings/latest").statusCode());

        BriefingSections sections = new BriefingSections("Moonshot leads.", "P", "S", List.of("Moonshot"), List.of());
        stores.runs.saveBriefing(new Briefing("b1", NOW.minusSeconds(60), sections.toMarkdown(), sections, 3, "m", "a1"));

        JsonNode latest = json(get("/api/briefings/latest"));
        assertEquals("b1", latest.get("id").asText());
        assertEquals("Moonshot leads.", latest.get("sections").get("lead").asText());
        assertEquals(1, json(get("/api/briefings?date=2026-03-02")).size());
        assertEquals(0, json(get("/api/briefings?date=2026-03-01")).size());
        assertEquals(400, get("/api/briefings?date=yesterday").statusCode());
        assertEquals(400, get("/api/briefings").statusCode());
    }

    @Test
    void signalTrendingSourcesAndStatusReturnJsonWhenEmpty() throws Exception {
        JsonNode signals = json(get("/api/signals?days=90"));
        assertEquals(30, signals.get("days").asInt());
        assertEquals(4, signals.get("minRelevance").asInt());
        assertEquals(0, signals.get("signalCount").asInt());

        JsonNode trending = json(get("/api/trending?days=7"));
        assertEquals(Category.values().length, trending.get("categories").size());

        assertEquals(0, json(get("/api/sources")).get("sources").size());

        JsonNode status = json(get("/api/status"));
        assertTrue(status.get("publishQueue").has("publishedToday"));
        assertTrue(status.get("articles").has("pending"));
        assertEquals(0, status.get("failed").asInt());
    }

    @Test
    void eventsEndpointSupportsSinceTypeAndLimitAndInvalidParams() throws Exception {
        eventBus.publish(new AlertRaised(NOW.minusSeconds(120), "source", "a", Map.of("source", "36kr")));
        eventBus.publish(new CycleStarted(NOW.minusSeconds(60), "scrape"));
        eventBus.publish(new AlertRaised(NOW, "source", "b", Map.of("source", "infoq")));

        assertEquals(3, json(get("/api/events")).size());
        JsonNode newestAlert = json(get("/api/events?type=AlertRaised&limit=1"));
        assertEquals(1, newestAlert.size());
        assertEquals("b", newestAlert.get(0).get("message").asText());
        assertEquals(2, json(get("/api/events?since=2026-03-02T11:59:00Z")).size());
        assertEquals(400, get("/api/events?since=noon").statusCode());
    }

    @Test
    void runEndpointTriggersCyclesAndGuardsOverlap() throws Exception {
        HttpResponse<String> published = post("/api/run/publish");
        assertEquals(200, published.statusCode());
        assertTrue(json(published).get("success").asBoolean());

        assertEquals(500, post("/api/run/analyze").statusCode());
        assertEquals(404, post("/api/run/maintenance").statusCode());
        assertEquals(404, post("/api/run/nope").statusCode());
        assertEquals(405, get("/api/run/publish").statusCode());

        CompletableFuture<HttpResponse<String>> running = client.sendAsync(
                HttpRequest.newBuilder(uri("/api/run/scrape")).POST(HttpRequest.BodyPublishers.noBody()).build(),
                HttpResponse.BodyHandlers.ofString()
        );
        assertTrue(scrapeEntered.await(5, TimeUnit.SECONDS));
        HttpResponse<String> conflict = post("/api/run/scrape");
        scrapeRelease.countDown();

        assertEquals(409, conflict.statusCode());
        assertEquals("already_running", json(conflict).get("error").asText());
        assertEquals(200, running.get(5, TimeUnit.SECONDS).statusCode());
    }

    @Test
    void runEndpointPassesPlatformAndModelOptions() throws Exception {
        assertEquals(200, post("/api/run/publish?platform=devto").statusCode());
        assertEquals(Map.of("platform", "devto"), receivedOptions.get("publish"));

        post("/api/run/publish");
        assertEquals(Map.of(), receivedOptions.get("publish"));

        post("/api/run/analyze?model=opus");
        assertEquals(Map.of("model", "opus"), receivedOptions.get("analyze"));

        receivedOptions.remove("analyze");
        HttpResponse<String> unknownModel = post("/api/run/analyze?model=gpt-4");
        assertEquals(400, unknownModel.statusCode());
        assertEquals("invalid_query_params", json(unknownModel).get("error").asText());
        assertNull(receivedOptions.get("analyze"));
    }

    @Test
    void queueSkipMovesClaimableItemsOnly() throws Exception {
        PublishQueueItem item = queue.enqueue("devto", "a1", "b1", "Title", "Body", null, Urgency.LOW, 3);

        HttpResponse<String> skipped = post("/api/queue/" + item.id() + "/skip");
        assertEquals(200, skipped.statusCode());
        assertEquals("skipped", json(skipped).get("status").asText());

        HttpResponse<String> again = post("/api/queue/" + item.id() + "/skip");
        assertEquals(409, again.statusCode());
        assertEquals("not_skippable", json(again).get("error").asText());

        assertEquals(404, post("/api/queue/unknown/skip").statusCode());
        assertEquals(404, post("/api/queue/" + item.id()).statusCode());
    }

    @Test
    void metricsEndpointReportsCounters() throws Exception {
        post("/api/run/publish");

        JsonNode metrics = json(get("/api/metrics"));
        assertTrue(metrics.get("eventsTotal").asLong() >= 2);
        assertTrue(metrics.get("cycles").has("publish"));
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path) throws Exception {
        return client.send(
                HttpRequest.newBuilder(uri(path)).POST(HttpRequest.BodyPublishers.noBody()).build(),
                HttpResponse.BodyHandlers.ofString()
        );
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + apiServer.actualPort() + path);
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return JsonUtils.objectMapper().readTree(response.body());
    }

    private Cycle cycle(String name, Supplier<CycleResult> behavior) {
        return new Cycle() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public CycleResult run() {
                return run(Map.of());
            }

            @Override
            public CycleResult run(Map<String, String> options) {
                receivedOptions.put(name, options);
                return behavior.get();
            }
        };
    }
}

package com.lexintel.service;

import com.lexintel.collectors.api.FetchContext;
import com.lexintel.collectors.api.SourceFetcher;
import com.lexintel.collectors.config.RssSourceConfig;
import com.lexintel.collectors.config.SourcesConfig;
import com.lexintel.collectors.rss.RssSourceFetcher;
import com.lexintel.core.bus.EventBus;
import com.lexintel.core.model.CycleConfig;
import com.lexintel.service.analyze.AnalyzeCycle;
import com.lexintel.service.analyze.ArticleHistoryContext;
import com.lexintel.service.analyze.ClassificationStage;
import com.lexintel.service.analyze.SynthesisStage;
import com.lexintel.service.api.ApiServer;
import com.lexintel.service.api.DiagnosticsTracker;
import com.lexintel.service.api.QueryServices;
import com.lexintel.service.config.ConfigLoader;
import com.lexintel.service.config.PipelineConfig;
import com.lexintel.service.embed.Embedder;
import com.lexintel.service.embed.HttpEmbedder;
import com.lexintel.service.ingest.Deduplicator;
import com.lexintel.service.ingest.Normalizer;
import com.lexintel.service.ingest.ScrapeCycle;
import com.lexintel.service.llm.AnthropicClient;
import com.lexintel.service.llm.LlmClient;
import com.lexintel.service.publish.DevToAdapter;
import com.lexintel.service.publish.HashnodeAdapter;
import com.lexintel.service.publish.LinkedInAdapter;
import com.lexintel.service.publish.PlatformAdapter;
import com.lexintel.service.publish.PublishQueueManager;
import com.lexintel.service.query.ArticleSearch;
import com.lexintel.service.query.StatusService;
import com.lexintel.service.runtime.Cycle;
import com.lexintel.service.runtime.FullCycle;
import com.lexintel.service.runtime.MaintenanceCycle;
import com.lexintel.service.runtime.PublishCycle;
import com.lexintel.service.runtime.SchedulerService;
import com.lexintel.service.signals.MomentumCalculator;
import com.lexintel.service.signals.SignalClusterer;
import com.lexintel.service.signals.SourceHealthReport;
import com.lexintel.service.store.EventCodec;
import com.lexintel.service.store.JsonFileArticleStore;
import com.lexintel.service.store.JsonFileDedupTitleStore;
import com.lexintel.service.store.JsonFilePublishQueueStore;
import com.lexintel.service.store.JsonFileRunStore;
import com.lexintel.service.store.JsonlEventStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final Map<String, Duration> DEFAULT_INTERVALS = Map.of(
            ScrapeCycle.NAME, Duration.ofHours(24),
            AnalyzeCycle.NAME, Duration.ofHours(24),
            PublishCycle.NAME, Duration.ofMinutes(15),
            MaintenanceCycle.NAME, Duration.ofHours(24),
            FullCycle.NAME, Duration.ofHours(24)
    );

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = Path.of("config");
        Path dataDir = Path.of("data");
        Path eventLogFile = Path.of("logs/events.jsonl");
        Map<String, String> env = System.getenv();
        Clock clock = Clock.systemUTC();

        PipelineConfig pipeline = ConfigLoader.loadPipeline(configDir);
        SourcesConfig sources = ConfigLoader.loadSources(configDir);
        List<CycleConfig> cycleConfigs = ConfigLoader.loadCycles(configDir);

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(eventLogFile);
        EventCodec.subscribeAll(eventBus, eventStore::append);
        DiagnosticsTracker diagnostics = new DiagnosticsTracker(eventBus, clock);

        JsonFileArticleStore articleStore = new JsonFileArticleStore(dataDir.resolve("articles.json"));
        JsonFileDedupTitleStore titleStore = new JsonFileDedupTitleStore(dataDir.resolve("dedup_titles.json"));
        JsonFilePublishQueueStore queueStore = new JsonFilePublishQueueStore(dataDir.resolve("publish_queue.json"));
        JsonFileRunStore runStore = new JsonFileRunStore(dataDir.resolve("runs.json"));

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        Embedder embedder = embedder(env, httpClient, pipeline.dedup().embedTimeout());
        LlmClient llm = llmClient(env, httpClient, pipeline.analysis());

        List<SourceFetcher> fetchers = new ArrayList<>();
        for (RssSourceConfig source : sources.sources()) {
            fetchers.add(new RssSourceFetcher(source, sources.maxItemsPerSource()));
        }
        ScrapeCycle scrape = new ScrapeCycle(
                fetchers,
                new FetchContext(httpClient, clock, Duration.ofSeconds(30)),
                new Normalizer(clock, pipeline.body().maxBodyChars(), pipeline.body().maxTitleChars()),
                new Deduplicator(articleStore, titleStore, embedder, pipeline.dedup(), clock),
                runStore,
                eventBus,
                clock
        );

        ExecutorService publishExecutor = Executors.newCachedThreadPool();
        PublishQueueManager queue = new PublishQueueManager(
                queueStore,
                articleStore,
                adapters(env, httpClient, pipeline.publish().publishTimeout()),
                pipeline.publish(),
                eventBus,
                clock,
                publishExecutor
        );
        AnalyzeCycle analyze = new AnalyzeCycle(
                new ClassificationStage(llm, articleStore, pipeline.analysis()),
                new SynthesisStage(llm, new ArticleHistoryContext(articleStore, clock), pipeline.analysis()),
                queue,
                runStore,
                pipeline,
                eventBus,
                clock
        );
        PublishCycle publish = new PublishCycle(queue, runStore, eventBus, clock);
        MaintenanceCycle maintenance = new MaintenanceCycle(articleStore, titleStore, pipeline, clock);
        FullCycle full = new FullCycle(scrape, analyze, queue, runStore, clock);

        Map<String, CycleConfig> configByName = new HashMap<>();
        for (CycleConfig cfg : cycleConfigs) {
            configByName.put(cfg.name(), cfg);
        }
        List<SchedulerService.ScheduledCycle> scheduled = new ArrayList<>();
        for (Cycle cycle : List.of(scrape, analyze, publish, maintenance, full)) {
            CycleConfig cfg = configByName.get(cycle.name());
            boolean enabled = cfg != null ? cfg.enabled() : !FullCycle.NAME.equals(cycle.name());
            Duration interval = cfg != null && cfg.intervalSeconds() > 0
                    ? Duration.ofSeconds(cfg.intervalSeconds())
                    : DEFAULT_INTERVALS.get(cycle.name());
            scheduled.add(new SchedulerService.ScheduledCycle(cycle, interval, enabled));
        }
        SchedulerService scheduler = new SchedulerService(scheduled, eventBus, clock);

        SourceHealthReport sourceHealth = new SourceHealthReport(articleStore, runStore, clock);
        QueryServices queries = new QueryServices(
                new ArticleSearch(articleStore, embedder, pipeline.dedup().embedTimeout()),
                runStore,
                new SignalClusterer(articleStore, pipeline.signals(), clock),
                new MomentumCalculator(articleStore, clock),
                sourceHealth,
                new StatusService(articleStore, queueStore, runStore, sourceHealth, clock),
                eventStore,
                pipeline.signals().defaultMinRelevance()
        );
        int port = Integer.parseInt(env.getOrDefault("PORT", "8080"));
        ApiServer apiServer = new ApiServer(port, queries, scheduler, queue, diagnostics);

        scheduler.start();
        apiServer.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            apiServer.stop();
            publishExecutor.shutdownNow();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static Map<String, PlatformAdapter> adapters(Map<String, String> env, HttpClient httpClient, Duration timeout) {
        Map<String, PlatformAdapter> adapters = new LinkedHashMap<>();
        String devtoKey = env.get("DEVTO_API_KEY");
        if (present(devtoKey)) {
            adapters.put(DevToAdapter.PLATFORM,
                    new DevToAdapter(httpClient, DevToAdapter.DEFAULT_ENDPOINT, devtoKey, timeout));
        } else {
            LOGGER.info("DEVTO_API_KEY not set; devto items will wait in the queue");
        }
        String hashnodeKey = env.get("HASHNODE_API_KEY");
        String publicationId = env.get("HASHNODE_PUBLICATION_ID");
        if (present(hashnodeKey) && present(publicationId)) {
            adapters.put(HashnodeAdapter.PLATFORM,
                    new HashnodeAdapter(httpClient, HashnodeAdapter.DEFAULT_ENDPOINT, hashnodeKey, publicationId, timeout));
        } else {
            LOGGER.info("HASHNODE_API_KEY or HASHNODE_PUBLICATION_ID not set; hashnode items will wait in the queue");
        }
        String linkedInToken = env.get("LINKEDIN_ACCESS_TOKEN");
        if (present(linkedInToken)) {
            adapters.put(LinkedInAdapter.PLATFORM,
                    new LinkedInAdapter(httpClient, LinkedInAdapter.DEFAULT_BASE, linkedInToken, timeout));
        } else {
            LOGGER.info("LINKEDIN_ACCESS_TOKEN not set; linkedin items will wait in the queue");
        }
        return adapters;
    }

    static Embedder embedder(Map<String, String> env, HttpClient httpClient, Duration timeout) {
        String url = env.get("EMBEDDING_URL");
        if (!present(url)) {
            LOGGER.warning("EMBEDDING_URL not set; semantic dedup is disabled and articles are accepted unverified");
            return Embedder.unavailable();
        }
        return new HttpEmbedder(httpClient, URI.create(url), env.get("EMBEDDING_API_KEY"),
                env.get("EMBEDDING_MODEL"), timeout);
    }

    static LlmClient llmClient(Map<String, String> env, HttpClient httpClient, PipelineConfig.Analysis analysis) {
        String apiKey = env.get("ANTHROPIC_API_KEY");
        if (!present(apiKey)) {
            LOGGER.warning("ANTHROPIC_API_KEY not set; analysis will leave articles pending");
            return LlmClient.unavailable(analysis.model());
        }
        return new AnthropicClient(httpClient, apiKey, analysis.model(), analysis.timeout());
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Unable to load logging.properties: " + e.getMessage());
        }
    }
}

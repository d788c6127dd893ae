package com.lexintel.service.api;

import com.lexintel.core.events.Event;
import com.lexintel.core.model.Article;
import com.lexintel.core.model.Briefing;
import com.lexintel.core.model.Category;
import com.lexintel.core.model.PublishQueueItem;
import com.lexintel.core.model.SignalThread;
import com.lexintel.core.util.JsonUtils;
import com.lexintel.service.analyze.AnalyzeCycle;
import com.lexintel.service.publish.PublishQueueManager;
import com.lexintel.service.query.ArticleSearch;
import com.lexintel.service.query.StatusService;
import com.lexintel.service.runtime.CycleResult;
import com.lexintel.service.runtime.SchedulerService;
import com.lexintel.service.signals.MomentumCalculator;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final int DETAIL_BODY_CHARS = 3000;
    static final Set<String> RUNNABLE_CYCLES = Set.of("scrape", "analyze", "publish", "cycle");
    static final Map<String, String> RUN_OPTIONS = Map.of("publish", "platform", "analyze", "model");

    private final int port;
    private final QueryServices queries;
    private final SchedulerService scheduler;
    private final PublishQueueManager queue;
    private final DiagnosticsTracker diagnostics;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            QueryServices queries,
            SchedulerService scheduler,
            PublishQueueManager queue,
            DiagnosticsTracker diagnostics
    ) {
        this.port = port;
        this.queries = queries;
        this.scheduler = scheduler;
        this.queue = queue;
        this.diagnostics = diagnostics;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(8);
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/articles/search", this::handleSearch);
            server.createContext("/api/articles/", this::handleArticle);
            server.createContext("/api/briefings/latest", this::handleLatestBriefing);
            server.createContext("/api/briefings", this::handleBriefingsOn);
            server.createContext("/api/signals", this::handleSignals);
            server.createContext("/api/trending", this::handleTrending);
            server.createContext("/api/sources", this::handleSources);
            server.createContext("/api/status", this::handleStatus);
            server.createContext("/api/events", this::handleEvents);
            server.createContext("/api/metrics", this::handleMetrics);
            server.createContext("/api/run/", this::handleRun);
            server.createContext("/api/queue/", this::handleQueue);
            server.start();
            LOGGER.info("API listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleSearch(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        ArticleSearch.Query query;
        try {
            Map<String, String> params = queryParams(exchange.getRequestURI());
            Category category = null;
            if (params.containsKey("category") && !params.get("category").isBlank()) {
                category = Category.parse(params.get("category"))
                        .orElseThrow(() -> new IllegalArgumentException("unknown category"));
            }
            query = new ArticleSearch.Query(
                    params.get("q"),
                    category,
                    intParam(params, "minRelevance", 1),
                    intParam(params, "limit", 10),
                    params.containsKey("minSimilarity") ? Double.parseDouble(params.get("minSimilarity")) : 0.0
            );
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        ArticleSearch.Result result = queries.articleSearch().search(query);
        List<Map<String, Object>> articles = new ArrayList<>();
        for (ArticleSearch.Hit hit : result.hits()) {
            Map<String, Object> view = articleView(hit.article(), false);
            view.put("similarity", hit.similarity());
            articles.add(view);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", result.query());
        body.put("semantic", result.semantic());
        body.put("total", articles.size());
        body.put("articles", articles);
        writeJson(exchange, 200, body);
    }

    private void handleArticle(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        String id = pathTail(exchange, "/api/articles/");
        if (id.isEmpty() || id.contains("/")) {
            writeJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        Optional<Article> article = queries.articleSearch().find(id);
        if (article.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "not_found", "id", id));
            return;
        }
        writeJson(exchange, 200, articleView(article.get(), true));
    }

    private void handleLatestBriefing(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        Optional<Briefing> latest = queries.runStore().latestBriefing();
        if (latest.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "no_briefing"));
            return;
        }
        writeJson(exchange, 200, latest.get());
    }

    private void handleBriefingsOn(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        LocalDate date;
        try {
            String raw = queryParams(exchange.getRequestURI()).get("date");
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("date is required");
            }
            date = LocalDate.parse(raw);
        } catch (IllegalArgumentException | DateTimeParseException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        writeJson(exchange, 200, queries.runStore().briefingsOn(date));
    }

    private void handleSignals(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        int days;
        int minRelevance;
        try {
            Map<String, String> params = queryParams(exchange.getRequestURI());
            days = queries.signalClusterer().clampDays(intParam(params, "days", 7));
            minRelevance = intParam(params, "minRelevance", queries.defaultMinRelevance());
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        List<SignalThread> threads = queries.signalClusterer().threads(days, minRelevance);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("days", days);
        body.put("minRelevance", minRelevance);
        body.put("articleCount", threads.stream().mapToInt(thread -> thread.members().size()).sum());
        body.put("signalCount", threads.size());
        body.put("signals", threads);
        writeJson(exchange, 200, body);
    }

    private void handleTrending(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        int days;
        try {
            days = MomentumCalculator.clampDays(intParam(queryParams(exchange.getRequestURI()), "days", 7));
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("days", days);
        body.put("categories", queries.momentumCalculator().momentum(days));
        writeJson(exchange, 200, body);
    }

    private void handleSources(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        int days;
        try {
            days = Math.max(1, intParam(queryParams(exchange.getRequestURI()), "days", 30));
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        writeJson(exchange, 200, Map.of("days", days, "sources", queries.sourceHealth().report(days)));
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        StatusService.Status status = queries.statusService().status();
        Map<String, Object> articles = new LinkedHashMap<>();
        status.articles().forEach((key, count) -> articles.put(key.wireName(), count));
        Map<String, Object> publishQueue = new LinkedHashMap<>();
        status.publishQueue().forEach((key, count) -> publishQueue.put(key.wireName(), count));
        publishQueue.put("publishedToday", status.publishedToday());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("latestRun", status.latestRun());
        body.put("articles", articles);
        body.put("publishQueue", publishQueue);
        body.put("failed", status.failed());
        body.put("sources", status.sources());
        body.put("cycles", diagnostics.cyclesSnapshot());
        writeJson(exchange, 200, body);
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        Instant since;
        Optional<String> type;
        int limit;
        try {
            Map<String, String> params = queryParams(exchange.getRequestURI());
            since = params.containsKey("since") ? Instant.parse(params.get("since")) : Instant.EPOCH;
            type = Optional.ofNullable(params.get("type")).filter(value -> !value.isBlank());
            limit = intParam(params, "limit", 200);
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        List<Event> events = queries.eventStore().query(since, type, Math.max(1, limit));
        writeJson(exchange, 200, events);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, diagnostics.metricsSnapshot());
    }

    private void handleRun(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        String name = pathTail(exchange, "/api/run/");
        if (!RUNNABLE_CYCLES.contains(name)) {
            writeJson(exchange, 404, Map.of("error", "unknown_cycle", "cycle", name));
            return;
        }
        Map<String, String> options;
        try {
            options = runOptions(name, queryParams(exchange.getRequestURI()));
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        if (scheduler.isRunning(name)) {
            writeJson(exchange, 409, Map.of("error", "already_running", "cycle", name));
            return;
        }
        Optional<CycleResult> result;
        try {
            result = scheduler.runOnce(name, options);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Triggered cycle " + name + " failed", e);
            writeJson(exchange, 500, Map.of("error", "cycle_failed", "cycle", name));
            return;
        }
        if (result.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "unknown_cycle", "cycle", name));
            return;
        }
        writeJson(exchange, result.get().success() ? 200 : 500, result.get());
    }

    static Map<String, String> runOptions(String cycle, Map<String, String> params) {
        String option = RUN_OPTIONS.get(cycle);
        String value = option == null ? null : params.get(option);
        if (value == null || value.isBlank()) {
            return Map.of();
        }
        if ("model".equals(option)) {
            AnalyzeCycle.resolveModel(value);
        }
        return Map.of(option, value.trim());
    }

    private void handleQueue(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        String tail = pathTail(exchange, "/api/queue/");
        if (!tail.endsWith("/skip")) {
            writeJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        String id = tail.substring(0, tail.length() - "/skip".length());
        Optional<PublishQueueItem> existing = queue.find(id);
        if (existing.isEmpty()) {
            writeJson(exchange, 404, Map.of("error", "not_found", "id", id));
            return;
        }
        Optional<PublishQueueItem> skipped = queue.skip(id);
        if (skipped.isEmpty()) {
            writeJson(exchange, 409, Map.of("error", "not_skippable", "id", id,
                    "status", existing.get().status().wireName()));
            return;
        }
        writeJson(exchange, 200, Map.of("id", id, "status", skipped.get().status().wireName()));
    }

    private static Map<String, Object> articleView(Article article, boolean detail) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", article.id());
        view.put("sourceId", article.sourceId());
        view.put("source", article.source());
        view.put("title", article.title());
        view.put("englishTitle", article.englishTitle());
        view.put("category", article.category());
        view.put("relevance", article.relevance());
        view.put("status", article.status());
        view.put("publishedAt", article.publishedAt());
        view.put("scrapedAt", article.scrapedAt());
        view.put("url", article.url());
        if (detail) {
            String body = article.body();
            view.put("body", body != null && body.length() > DETAIL_BODY_CHARS ? body.substring(0, DETAIL_BODY_CHARS) : body);
            view.put("semanticUnverified", article.semanticUnverified());
        }
        return view;
    }

    private boolean ensureMethod(HttpExchange exchange, String method) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", method + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", method);
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private static String pathTail(HttpExchange exchange, String prefix) {
        String path = exchange.getRequestURI().getPath();
        if (!path.startsWith(prefix)) {
            return "";
        }
        return URLDecoder.decode(path.substring(prefix.length()), StandardCharsets.UTF_8);
    }

    private static int intParam(Map<String, String> params, String name, int fallback) {
        String raw = params.get(name);
        return raw == null || raw.isBlank() ? fallback : Integer.parseInt(raw.trim());
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }
}

package com.lexintel.service.analyze;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexintel.core.model.Article;
import com.lexintel.core.model.ArticleStatus;
import com.lexintel.core.model.Category;
import com.lexintel.service.config.PipelineConfig;
import com.lexintel.service.llm.AnalysisParseException;
import com.lexintel.service.llm.LlmClient;
import com.lexintel.service.llm.LlmJson;
import com.lexintel.service.store.ArticleStore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Stage 1: translate, categorize and score pending articles in batches. An article whose
 * result is missing or malformed stays {@code pending}; nothing is defaulted.
 */
public class ClassificationStage {
    private static final Logger LOGGER = Logger.getLogger(ClassificationStage.class.getName());
    static final String SCHEMA_HINT = "Respond with a JSON array only. Each element: "
            + "{\"index\": N, \"english_title\": \"...\", \"category\": \"...\", \"relevance\": N}";

    private final LlmClient llm;
    private final ArticleStore articleStore;
    private final PipelineConfig.Analysis settings;

    public ClassificationStage(LlmClient llm, ArticleStore articleStore, PipelineConfig.Analysis settings) {
        this.llm = llm;
        this.articleStore = articleStore;
        this.settings = settings;
    }

    public StageOneReport classifyPending() {
        return classifyPending(Optional.empty());
    }

    public StageOneReport classifyPending(Optional<String> model) {
        LlmClient client = model.map(llm::withModel).orElse(llm);
        List<Article> pending = articleStore.pending(settings.pendingLimit());
        List<Article> classified = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int leftPending = 0;
        int batches = 0;
        int batchesFailed = 0;

        for (int start = 0; start < pending.size(); start += settings.batchSize()) {
            List<Article> batch = pending.subList(start, Math.min(pending.size(), start + settings.batchSize()));
            batches++;
            try {
                JsonNode results = requestBatch(client, batch);
                BatchOutcome outcome = applyResults(batch, results);
                classified.addAll(outcome.classified());
                leftPending += outcome.rejected();
                errors.addAll(outcome.errors());
            } catch (AnalysisParseException | CompletionException | CancellationException e) {
                batchesFailed++;
                leftPending += batch.size();
                String message = "Batch " + batches + " left pending: " + describe(e);
                errors.add(message);
                LOGGER.warning(message);
            }
        }
        LOGGER.info("Stage 1: " + classified.size() + "/" + pending.size() + " classified in " + batches + " batches");
        return new StageOneReport(
                pending.stream().map(Article::id).toList(),
                classified,
                leftPending,
                batches,
                batchesFailed,
                errors
        );
    }

    private JsonNode requestBatch(LlmClient client, List<Article> batch) throws AnalysisParseException {
        String text = client.complete(prompt(batch), SCHEMA_HINT)
                .orTimeout(settings.timeout().toMillis(), TimeUnit.MILLISECONDS)
                .join();
        JsonNode parsed = LlmJson.parse(text);
        JsonNode results = parsed.isArray() ? parsed : parsed.path("articles");
        if (!results.isArray()) {
            throw new AnalysisParseException("Expected a JSON array of classifications");
        }
        return results;
    }

    private BatchOutcome applyResults(List<Article> batch, JsonNode results) {
        Map<Integer, JsonNode> byIndex = new HashMap<>();
        for (JsonNode result : results) {
            JsonNode index = result.path("index");
            if (index.isIntegralNumber()) {
                byIndex.putIfAbsent(index.asInt(), result);
            }
        }
        List<Article> classified = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int rejected = 0;
        for (int i = 0; i < batch.size(); i++) {
            Article article = batch.get(i);
            Optional<Enrichment> enrichment = validate(byIndex.get(i));
            if (enrichment.isEmpty()) {
                rejected++;
                errors.add("No valid classification for article " + article.id());
                LOGGER.fine(() -> "Leaving " + article.id() + " pending: missing or malformed classification");
                continue;
            }
            Enrichment value = enrichment.get();
            articleStore.update(article.id(), current -> current.status() == ArticleStatus.PENDING
                            ? current.withEnrichment(value.englishTitle(), value.category(), value.relevance())
                            : current)
                    .filter(updated -> updated.status() == ArticleStatus.ANALYZED)
                    .ifPresent(classified::add);
        }
        return new BatchOutcome(classified, rejected, errors);
    }

    static Optional<Enrichment> validate(JsonNode result) {
        if (result == null) {
            return Optional.empty();
        }
        String englishTitle = result.path("english_title").asText("").trim();
        Optional<Category> category = result.path("category").isTextual()
                ? Category.parse(result.path("category").asText())
                : Optional.empty();
        JsonNode relevance = result.path("relevance");
        if (englishTitle.isEmpty() || category.isEmpty() || !relevance.isIntegralNumber()) {
            return Optional.empty();
        }
        int score = relevance.asInt();
        if (score < Article.MIN_RELEVANCE || score > Article.MAX_RELEVANCE) {
            return Optional.empty();
        }
        return Optional.of(new Enrichment(englishTitle, category.get(), score));
    }

    static String prompt(List<Article> batch) {
        String items = java.util.stream.IntStream.range(0, batch.size())
                .mapToObj(i -> {
                    Article article = batch.get(i);
                    return "[" + i + "] SOURCE: " + article.source()
                            + " | TITLE: " + clip(article.title(), 200)
                            + " | SUMMARY: " + clip(article.body(), 300);
                })
                .collect(Collectors.joining("\n"));
        return "You are a technology intelligence analyst. For each article below:\n"
                + "1. Translate the title to English (if already English, keep as-is)\n"
                + "2. Categorize: " + categoryList() + "\n"
                + "3. Score relevance 1-5 for enterprise technology and AI (5 = critical, 1 = irrelevant)\n\n"
                + "Return a JSON array. Each element: {\"index\": N, \"english_title\": \"...\", "
                + "\"category\": \"...\", \"relevance\": N}\n\n"
                + "ARTICLES:\n" + items + "\n\nRespond with a valid JSON array only.";
    }

    private static String categoryList() {
        return java.util.Arrays.stream(Category.values()).map(Category::wireName).collect(Collectors.joining(", "));
    }

    private static String clip(String value, int max) {
        if (value == null) {
            return "";
        }
        String flat = value.replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max);
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    record Enrichment(String englishTitle, Category category, int relevance) {
    }

    private record BatchOutcome(List<Article> classified, int rejected, List<String> errors) {
    }
}

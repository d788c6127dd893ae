package com.lexintel.service.analyze;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexintel.core.model.Article;
import com.lexintel.core.model.BriefingSections;
import com.lexintel.core.model.Category;
import com.lexintel.core.model.DraftPost;
import com.lexintel.core.model.Urgency;
import com.lexintel.service.config.PipelineConfig;
import com.lexintel.service.llm.AnalysisParseException;
import com.lexintel.service.llm.LlmClient;
import com.lexintel.service.llm.LlmJson;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Stage 2: one briefing with five fixed sections plus a bounded set of post drafts.
 * Output that fails structural validation is requested once more with the same input.
 */
public class SynthesisStage {
    private static final Logger LOGGER = Logger.getLogger(SynthesisStage.class.getName());
    static final int MAX_ATTEMPTS = 2;
    static final String SCHEMA_HINT = "Respond with valid JSON only, shaped as "
            + "{\"briefing\": {\"lead\": \"...\", \"patterns\": \"...\", \"signals\": \"...\", "
            + "\"watchlist\": [\"...\"], \"data\": [\"...\"]}, "
            + "\"drafts\": [{\"article_id\": \"...\", \"urgency\": \"high|medium|low\", \"title\": \"...\", "
            + "\"long_form\": \"...\", \"short_form\": \"...\"}]}";

    private final LlmClient llm;
    private final HistoricalContextProvider history;
    private final PipelineConfig.Analysis settings;

    public SynthesisStage(LlmClient llm, HistoricalContextProvider history, PipelineConfig.Analysis settings) {
        this.llm = llm;
        this.history = history;
        this.settings = settings;
    }

    public SynthesisResult synthesize(List<Article> articles) {
        return synthesize(articles, Optional.empty());
    }

    public SynthesisResult synthesize(List<Article> articles, Optional<String> model) {
        LlmClient client = model.map(llm::withModel).orElse(llm);
        if (articles.isEmpty()) {
            return SynthesisResult.failure("No articles above the relevance threshold", 0);
        }
        String prompt = prompt(articles, history.contextFor(articles));
        String lastError = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                String text = client.complete(prompt, SCHEMA_HINT)
                        .orTimeout(settings.timeout().toMillis(), TimeUnit.MILLISECONDS)
                        .join();
                Parsed parsed = parse(LlmJson.parse(text), articles);
                LOGGER.info("Stage 2 produced a briefing and " + parsed.drafts().size() + " drafts on attempt " + attempt);
                return SynthesisResult.success(parsed.sections(), parsed.drafts(), attempt);
            } catch (AnalysisParseException | CompletionException | CancellationException e) {
                lastError = describe(e);
                LOGGER.warning("Stage 2 attempt " + attempt + "/" + MAX_ATTEMPTS + " rejected: " + lastError);
            }
        }
        return SynthesisResult.failure(lastError, MAX_ATTEMPTS);
    }

    Parsed parse(JsonNode root, List<Article> articles) throws AnalysisParseException {
        JsonNode briefing = root.path("briefing");
        if (!briefing.isObject()) {
            throw new AnalysisParseException("Missing briefing object");
        }
        String lead = briefing.path("lead").asText("").trim();
        if (lead.isEmpty()) {
            throw new AnalysisParseException("Briefing lead is empty");
        }
        BriefingSections sections = new BriefingSections(
                lead,
                briefing.path("patterns").asText("").trim(),
                briefing.path("signals").asText("").trim(),
                lines(briefing.path("watchlist")),
                lines(briefing.path("data"))
        );

        Map<String, Article> byId = articles.stream()
                .collect(Collectors.toMap(Article::id, Function.identity(), (a, b) -> a));
        JsonNode draftNodes = root.path("drafts");
        if (!draftNodes.isArray()) {
            throw new AnalysisParseException("Missing drafts array");
        }
        List<DraftPost> drafts = new ArrayList<>();
        int index = 0;
        for (JsonNode node : draftNodes) {
            drafts.add(draft(node, index++, byId));
        }
        int required = Math.min(settings.minDrafts(), articles.size());
        if (drafts.size() < required) {
            throw new AnalysisParseException("Expected at least " + required + " drafts but got " + drafts.size());
        }
        if (drafts.size() > settings.maxDrafts()) {
            LOGGER.fine(() -> "Keeping the first " + settings.maxDrafts() + " of " + draftNodes.size() + " drafts");
            drafts = drafts.subList(0, settings.maxDrafts());
        }
        return new Parsed(sections, List.copyOf(drafts));
    }

    private static DraftPost draft(JsonNode node, int index, Map<String, Article> byId) throws AnalysisParseException {
        String articleId = node.path("article_id").asText("").trim();
        Article source = byId.get(articleId);
        if (source == null) {
            throw new AnalysisParseException("Draft " + index + " references unknown article id '" + articleId + "'");
        }
        Optional<Urgency> urgency = node.path("urgency").isTextual()
                ? Urgency.parse(node.path("urgency").asText())
                : Optional.empty();
        if (urgency.isEmpty()) {
            throw new AnalysisParseException("Draft " + index + " has invalid urgency " + node.path("urgency"));
        }
        String longForm = node.path("long_form").asText("").trim();
        String shortForm = node.path("short_form").asText("").trim();
        if (longForm.isEmpty() && shortForm.isEmpty()) {
            throw new AnalysisParseException("Draft " + index + " has no content");
        }
        String title = node.path("title").asText("").trim();
        return new DraftPost(
                articleId,
                urgency.get(),
                title.isEmpty() ? source.displayTitle() : title,
                longForm.isEmpty() ? shortForm : longForm,
                shortForm.isEmpty() ? longForm : shortForm
        );
    }

    private static List<String> lines(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                String text = element.asText("").trim();
                if (!text.isEmpty()) {
                    values.add(text);
                }
            }
        } else if (node.isTextual()) {
            node.asText().lines()
                    .map(line -> line.replaceFirst("^\\s*[-*]\\s*", "").trim())
                    .filter(line -> !line.isEmpty())
                    .forEach(values::add);
        }
        return values;
    }

    static String prompt(List<Article> articles, String historicalContext) {
        Map<Category, List<Article>> byCategory = new TreeMap<>(Comparator.comparing(Category::wireName));
        for (Article article : articles) {
            byCategory.computeIfAbsent(article.category(), ignored -> new ArrayList<>()).add(article);
        }
        StringBuilder categorized = new StringBuilder();
        byCategory.forEach((category, members) -> {
            categorized.append("\n## ").append(category.wireName().toUpperCase(java.util.Locale.ROOT))
                    .append(" (").append(members.size()).append(" articles)\n");
            for (Article article : members) {
                categorized.append("- id=").append(article.id())
                        .append(" [").append(article.source()).append("] (relevance:")
                        .append(article.relevance()).append(") ").append(article.displayTitle()).append('\n');
                String body = article.body() == null ? "" : article.body().replace('\n', ' ');
                if (!body.isBlank()) {
                    categorized.append("  Summary: ").append(body, 0, Math.min(200, body.length())).append('\n');
                }
            }
        });
        String context = historicalContext == null || historicalContext.isBlank()
                ? "No related prior coverage."
                : historicalContext;
        return "Analyze these categorized technology articles and produce two outputs.\n\n"
                + "1. MORNING BRIEFING with sections LEAD (biggest story), PATTERNS (cross-source themes), "
                + "SIGNALS (emerging trends), WATCHLIST (entities to track), DATA (key numbers).\n"
                + "2. POST DRAFTS for the 3-5 most notable items. Each draft references one article id above, "
                + "carries an urgency of high, medium or low, and has a long_form article and a short_form post.\n\n"
                + "If several sources report the same theme, that is a signal.\n\n"
                + "RELATED PRIOR COVERAGE:\n" + context + "\n\n"
                + "CATEGORIZED ARTICLES:" + categorized + "\nRespond with valid JSON only.";
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }

    record Parsed(BriefingSections sections, List<DraftPost> drafts) {
    }
}

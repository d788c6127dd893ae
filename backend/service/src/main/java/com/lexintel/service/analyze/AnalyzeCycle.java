package com.lexintel.service.analyze;

import com.lexintel.core.bus.EventBus;
import com.lexintel.core.events.AlertRaised;
import com.lexintel.core.events.BriefingGenerated;
import com.lexintel.core.model.AnalysisRun;
import com.lexintel.core.model.Article;
import com.lexintel.core.model.Briefing;
import com.lexintel.core.model.DraftPost;
import com.lexintel.core.model.RunMode;
import com.lexintel.core.model.ScrapeRun;
import com.lexintel.service.config.PipelineConfig;
import com.lexintel.service.config.PlatformConfig;
import com.lexintel.service.publish.PublishQueueManager;
import com.lexintel.service.runtime.Cycle;
import com.lexintel.service.runtime.CycleResult;
import com.lexintel.service.store.RunStore;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

public class AnalyzeCycle implements Cycle {
    public static final String NAME = "analyze";
    private static final Logger LOGGER = Logger.getLogger(AnalyzeCycle.class.getName());
    static final Map<String, String> MODEL_TIERS = Map.of(
            "sonnet", "claude-sonnet-4-20250514",
            "opus", "claude-opus-4-20250514"
    );

    private final ClassificationStage classification;
    private final SynthesisStage synthesis;
    private final PublishQueueManager queue;
    private final RunStore runStore;
    private final PipelineConfig.Analysis analysisConfig;
    private final List<PlatformConfig> platforms;
    private final EventBus eventBus;
    private final Clock clock;

    public AnalyzeCycle(
            ClassificationStage classification,
            SynthesisStage synthesis,
            PublishQueueManager queue,
            RunStore runStore,
            PipelineConfig config,
            EventBus eventBus,
            Clock clock
    ) {
        this.classification = classification;
        this.synthesis = synthesis;
        this.queue = queue;
        this.runStore = runStore;
        this.analysisConfig = config.analysis();
        this.platforms = config.publish().platforms();
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

    // Accepts model: a tier name from MODEL_TIERS or a full model id.
    @Override
    public CycleResult run(Map<String, String> options) {
        Optional<String> model = Optional.ofNullable(options.get("model"))
                .filter(value -> !value.isBlank())
                .map(AnalyzeCycle::resolveModel);
        AnalysisRun run = analyze(model);
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("runId", run.id());
        stats.put("articlesConsumed", run.articlesConsumed());
        stats.put("classified", run.classified());
        stats.put("leftPending", run.leftPending());
        stats.put("draftCount", run.draftCount());
        stats.put("postsQueued", run.postsQueued());
        if (run.briefingId() != null) {
            stats.put("briefingId", run.briefingId());
        }
        if (run.error() != null) {
            return CycleResult.failure(NAME, "Analysis failed: " + run.error(), stats);
        }
        if (!run.synthesisSucceeded()) {
            return CycleResult.success(NAME, "Classified " + run.classified()
                    + " articles, none relevant enough for a briefing", stats);
        }
        return CycleResult.success(NAME, "Briefing " + run.briefingId() + " with " + run.draftCount()
                + " drafts, " + run.postsQueued() + " posts queued", stats);
    }

    public static String resolveModel(String requested) {
        String trimmed = requested.trim();
        String tier = MODEL_TIERS.get(trimmed.toLowerCase(Locale.ROOT));
        if (tier != null) {
            return tier;
        }
        if (trimmed.startsWith("claude-")) {
            return trimmed;
        }
        throw new IllegalArgumentException("Unknown model tier: " + requested);
    }

    public AnalysisRun analyze() {
        return analyze(Optional.empty());
    }

    public AnalysisRun analyze(Optional<String> modelOverride) {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        String model = modelOverride.orElse(analysisConfig.model());
        if (modelOverride.isPresent()) {
            LOGGER.info("Analysis " + runId + " using model " + model);
        }
        try {
            StageOneReport stageOne = classification.classifyPending(modelOverride);
            List<Article> relevant = stageOne.classified().stream()
                    .filter(article -> article.relevance() != null
                            && article.relevance() >= analysisConfig.minRelevanceForSynthesis())
                    .toList();
            LOGGER.info("Relevance filter: " + stageOne.classified().size() + " -> " + relevant.size()
                    + " (relevance >= " + analysisConfig.minRelevanceForSynthesis() + ")");

            AnalysisRun run;
            if (relevant.isEmpty()) {
                run = finish(runId, startedAt, model, stageOne, 0, null, 0, 0, false, null);
            } else {
                SynthesisResult result = synthesis.synthesize(relevant, modelOverride);
                if (result.success()) {
                    run = publishBriefing(runId, startedAt, model, stageOne, relevant, result);
                } else {
                    LOGGER.warning("Synthesis failed after " + result.attempts() + " attempts: " + result.error());
                    eventBus.publish(new AlertRaised(clock.instant(), "analysis",
                            "Briefing synthesis failed: " + result.error(), Map.of("runId", runId)));
                    run = finish(runId, startedAt, model, stageOne, relevant.size(), null, 0, 0, false, result.error());
                }
            }
            runStore.saveAnalysisRun(run);
            runStore.saveScrapeRun(new ScrapeRun(runId, RunMode.ANALYZE, startedAt, run.finishedAt(),
                    stageOne.inputIds().size(), relevant.size(), 0, 0, 0,
                    List.of("analyze_pipeline"), List.of(), run.error()));
            return run;
        } catch (IllegalStateException storageError) {
            LOGGER.log(Level.SEVERE, "Analysis " + runId + " aborted", storageError);
            String reason = storageError.getMessage() != null ? storageError.getMessage() : storageError.toString();
            eventBus.publish(new AlertRaised(clock.instant(), "cycle", "Analysis aborted: " + reason,
                    Map.of("cycle", NAME, "runId", runId)));
            AnalysisRun failed = new AnalysisRun(runId, startedAt, clock.instant(), model,
                    List.of(), 0, 0, 0, null, 0, 0, false, reason);
            try {
                runStore.saveScrapeRun(ScrapeRun.failed(runId, RunMode.ANALYZE, startedAt, clock.instant(), reason));
            } catch (IllegalStateException e) {
                LOGGER.log(Level.SEVERE, "Unable to record failed analysis run " + runId, e);
            }
            return failed;
        }
    }

    private AnalysisRun publishBriefing(
            String runId,
            Instant startedAt,
            String model,
            StageOneReport stageOne,
            List<Article> relevant,
            SynthesisResult result
    ) {
        String text = result.sections().toMarkdown();
        Briefing briefing = new Briefing(UUID.randomUUID().toString(), clock.instant(), text, result.sections(),
                relevant.size(), model, runId);
        runStore.saveBriefing(briefing);
        LOGGER.info("Briefing " + briefing.id() + " saved (" + text.length() + " chars, "
                + result.drafts().size() + " drafts)");

        String fallback = BriefingText.leadParagraph(text);
        int queued = 0;
        for (DraftPost draft : result.drafts()) {
            for (PlatformConfig platform : platforms) {
                String body = platform.format() == PlatformConfig.Format.LONG ? draft.longForm() : draft.shortForm();
                queue.enqueue(platform.name(), draft.articleId(), briefing.id(), draft.title(), body, fallback,
                        draft.urgency(), platform.maxRetries());
                queued++;
            }
        }
        LOGGER.info("Queued " + queued + " posts for publishing");
        eventBus.publish(new BriefingGenerated(clock.instant(), briefing.id(), relevant.size(),
                result.drafts().size()));
        return finish(runId, startedAt, model, stageOne, relevant.size(), briefing.id(), result.drafts().size(),
                queued, true, null);
    }

    private AnalysisRun finish(
            String runId,
            Instant startedAt,
            String model,
            StageOneReport stageOne,
            int consumed,
            String briefingId,
            int drafts,
            int queued,
            boolean synthesized,
            String error
    ) {
        return new AnalysisRun(runId, startedAt, clock.instant(), model, stageOne.inputIds(),
                consumed, stageOne.classified().size(), stageOne.leftPending(), briefingId, drafts, queued,
                synthesized, error);
    }
}

package com.lexintel.service.config;

import java.time.Duration;
import java.util.List;

public record PipelineConfig(
        Dedup dedup,
        Analysis analysis,
        Signals signals,
        Publish publish,
        Body body,
        Maintenance maintenance
) {
    public PipelineConfig {
        dedup = dedup == null ? Dedup.defaults() : dedup;
        analysis = analysis == null ? Analysis.defaults() : analysis;
        signals = signals == null ? Signals.defaults() : signals;
        publish = publish == null ? Publish.defaults() : publish;
        body = body == null ? Body.defaults() : body;
        maintenance = maintenance == null ? Maintenance.defaults() : maintenance;
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(null, null, null, null, null, null);
    }

    public record Dedup(
            int windowSize,
            int maxAgeDays,
            double semanticThreshold,
            int semanticLookbackDays,
            int semanticCandidateLimit,
            Duration embedTimeout
    ) {
        public Dedup {
            windowSize = windowSize > 0 ? windowSize : 500;
            maxAgeDays = maxAgeDays > 0 ? maxAgeDays : 30;
            semanticThreshold = semanticThreshold > 0 ? semanticThreshold : 0.85;
            semanticLookbackDays = semanticLookbackDays > 0 ? semanticLookbackDays : 30;
            semanticCandidateLimit = semanticCandidateLimit > 0 ? semanticCandidateLimit : 2000;
            embedTimeout = positiveOr(embedTimeout, Duration.ofSeconds(20));
        }

        public static Dedup defaults() {
            return new Dedup(0, 0, 0, 0, 0, null);
        }
    }

    public record Analysis(
            String model,
            int batchSize,
            int pendingLimit,
            int minRelevanceForSynthesis,
            int maxDrafts,
            int minDrafts,
            Duration timeout
    ) {
        public Analysis {
            model = model == null || model.isBlank() ? "claude-sonnet-4-20250514" : model;
            batchSize = batchSize > 0 ? batchSize : 50;
            pendingLimit = pendingLimit > 0 ? pendingLimit : 500;
            minRelevanceForSynthesis = minRelevanceForSynthesis > 0 ? minRelevanceForSynthesis : 3;
            maxDrafts = maxDrafts > 0 ? maxDrafts : 5;
            minDrafts = minDrafts > 0 ? minDrafts : 3;
            timeout = positiveOr(timeout, Duration.ofSeconds(120));
        }

        public static Analysis defaults() {
            return new Analysis(null, 0, 0, 0, 0, 0, null);
        }
    }

    public record Signals(double clusterThreshold, int defaultMinRelevance, int maxDays) {
        public Signals {
            clusterThreshold = clusterThreshold > 0 ? clusterThreshold : 0.7;
            defaultMinRelevance = defaultMinRelevance > 0 ? defaultMinRelevance : 4;
            maxDays = maxDays > 0 ? maxDays : 30;
        }

        public static Signals defaults() {
            return new Signals(0, 0, 0);
        }
    }

    public record Publish(
            List<PlatformConfig> platforms,
            Duration backoffBase,
            int backoffMultiplier,
            Duration backoffCap,
            Duration publishTimeout,
            Duration claimLease,
            int drainLimit
    ) {
        public Publish {
            platforms = platforms == null || platforms.isEmpty() ? PlatformConfig.defaults() : List.copyOf(platforms);
            backoffBase = positiveOr(backoffBase, Duration.ofMinutes(5));
            backoffMultiplier = backoffMultiplier > 1 ? backoffMultiplier : 4;
            backoffCap = positiveOr(backoffCap, Duration.ofHours(6));
            publishTimeout = positiveOr(publishTimeout, Duration.ofSeconds(30));
            claimLease = positiveOr(claimLease, Duration.ofMinutes(10));
            drainLimit = drainLimit > 0 ? drainLimit : 20;
        }

        public static Publish defaults() {
            return new Publish(null, null, 0, null, null, null, 0);
        }
    }

    public record Body(int maxBodyChars, int maxTitleChars) {
        public Body {
            maxBodyChars = maxBodyChars > 0 ? maxBodyChars : 10_000;
            maxTitleChars = maxTitleChars > 0 ? maxTitleChars : 1_000;
        }

        public static Body defaults() {
            return new Body(0, 0);
        }
    }

    public record Maintenance(int archiveAfterDays) {
        public Maintenance {
            archiveAfterDays = archiveAfterDays > 0 ? archiveAfterDays : 90;
        }

        public static Maintenance defaults() {
            return new Maintenance(0);
        }
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}

package com.lexintel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record ScrapeRun(
        String id,
        RunMode mode,
        Instant startedAt,
        Instant finishedAt,
        int articlesFound,
        int articlesNew,
        int rejectedExact,
        int rejectedSemantic,
        int unverifiedSemantic,
        List<String> sourcesOk,
        List<String> sourcesFailed,
        String error
) {
    public ScrapeRun {
        sourcesOk = sourcesOk == null ? List.of() : List.copyOf(sourcesOk);
        sourcesFailed = sourcesFailed == null ? List.of() : List.copyOf(sourcesFailed);
    }

    public static ScrapeRun failed(String id, RunMode mode, Instant startedAt, Instant finishedAt, String error) {
        return new ScrapeRun(id, mode, startedAt, finishedAt, 0, 0, 0, 0, 0, List.of(), List.of(), error);
    }

    public double durationSeconds() {
        if (finishedAt == null) {
            return 0;
        }
        return Math.round(Duration.between(startedAt, finishedAt).toMillis() / 100.0) / 10.0;
    }

    public boolean succeeded() {
        return error == null;
    }
}

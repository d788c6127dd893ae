package com.lexintel.core.model;

import java.time.Instant;
import java.util.List;

public record AnalysisRun(
        String id,
        Instant startedAt,
        Instant finishedAt,
        String model,
        List<String> inputArticleIds,
        int articlesConsumed,
        int classified,
        int leftPending,
        String briefingId,
        int draftCount,
        int postsQueued,
        boolean synthesisSucceeded,
        String error
) {
    public AnalysisRun {
        inputArticleIds = inputArticleIds == null ? List.of() : List.copyOf(inputArticleIds);
    }
}

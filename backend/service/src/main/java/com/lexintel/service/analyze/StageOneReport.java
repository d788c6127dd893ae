package com.lexintel.service.analyze;

import com.lexintel.core.model.Article;

import java.util.List;

public record StageOneReport(
        List<String> inputIds,
        List<Article> classified,
        int leftPending,
        int batches,
        int batchesFailed,
        List<String> errors
) {
    public StageOneReport {
        inputIds = List.copyOf(inputIds);
        classified = List.copyOf(classified);
        errors = List.copyOf(errors);
    }
}

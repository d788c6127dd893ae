package com.lexintel.service.publish;

import java.util.List;

public record DrainReport(
        int reclaimed,
        int attempted,
        int published,
        int publishedViaFallback,
        int retryQueued,
        int failed,
        int conflicts,
        int skippedNoAdapter,
        boolean interrupted,
        List<String> processedIds
) {
    public DrainReport {
        processedIds = List.copyOf(processedIds);
    }
}

package com.lexintel.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record PublishQueueItem(
        String id,
        long sequence,
        String platform,
        String articleId,
        String briefingId,
        String title,
        String body,
        String fallbackBody,
        Urgency urgency,
        int priority,
        PublishStatus status,
        int retryCount,
        int maxRetries,
        Instant nextRetryAt,
        List<PublishLogEntry> publishLog,
        Instant createdAt,
        Instant claimedAt,
        String claimToken,
        Instant publishedAt,
        String platformId,
        String error
) {
    public PublishQueueItem {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(platform, "platform is required");
        Objects.requireNonNull(urgency, "urgency is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("body must not be empty");
        }
        if (maxRetries < 0 || retryCount < 0 || retryCount > maxRetries) {
            throw new IllegalArgumentException(
                    "retryCount " + retryCount + " must be within [0," + maxRetries + "]");
        }
        publishLog = publishLog == null ? List.of() : List.copyOf(publishLog);
    }

    public static PublishQueueItem queued(
            String id,
            long sequence,
            String platform,
            String articleId,
            String briefingId,
            String title,
            String body,
            String fallbackBody,
            Urgency urgency,
            int maxRetries,
            Instant createdAt
    ) {
        return new PublishQueueItem(id, sequence, platform, articleId, briefingId, title, body, fallbackBody,
                urgency, urgency.priority(), PublishStatus.QUEUED, 0, maxRetries, null, List.of(),
                createdAt, null, null, null, null, null);
    }

    public boolean hasFallback() {
        return fallbackBody != null && !fallbackBody.isBlank();
    }

    /** True until an attempt has been settled as a retry; a released claim does not count. */
    public boolean firstAttempt() {
        return retryCount == 0;
    }

    public boolean eligibleAt(Instant now) {
        if (status == PublishStatus.QUEUED) {
            return true;
        }
        return status == PublishStatus.RETRY_QUEUED && (nextRetryAt == null || !nextRetryAt.isAfter(now));
    }

    public PublishQueueItem claimed(String token, Instant now) {
        return new PublishQueueItem(id, sequence, platform, articleId, briefingId, title, body, fallbackBody,
                urgency, priority, PublishStatus.PUBLISHING, retryCount, maxRetries, nextRetryAt, publishLog,
                createdAt, now, token, publishedAt, platformId, error);
    }

    public PublishQueueItem published(Instant now, String assignedId, List<PublishLogEntry> entries) {
        return new PublishQueueItem(id, sequence, platform, articleId, briefingId, title, body, fallbackBody,
                urgency, priority, PublishStatus.PUBLISHED, retryCount, maxRetries, null, append(entries),
                createdAt, null, null, now, assignedId, null);
    }

    public PublishQueueItem retryQueued(Instant retryAt, List<PublishLogEntry> entries, String lastError) {
        return new PublishQueueItem(id, sequence, platform, articleId, briefingId, title, body, fallbackBody,
                urgency, priority, PublishStatus.RETRY_QUEUED, retryCount + 1, maxRetries, retryAt, append(entries),
                createdAt, null, null, null, null, lastError);
    }

    public PublishQueueItem failed(List<PublishLogEntry> entries, String lastError) {
        return new PublishQueueItem(id, sequence, platform, articleId, briefingId, title, body, fallbackBody,
                urgency, priority, PublishStatus.FAILED, retryCount, maxRetries, null, append(entries),
                createdAt, null, null, null, null, lastError);
    }

    public PublishQueueItem released(List<PublishLogEntry> entries) {
        return new PublishQueueItem(id, sequence, platform, articleId, briefingId, title, body, fallbackBody,
                urgency, priority, PublishStatus.RETRY_QUEUED, retryCount, maxRetries, null, append(entries),
                createdAt, null, null, null, null, error);
    }

    public PublishQueueItem skipped() {
        return new PublishQueueItem(id, sequence, platform, articleId, briefingId, title, body, fallbackBody,
                urgency, priority, PublishStatus.SKIPPED, retryCount, maxRetries, null, publishLog,
                createdAt, null, null, null, null, error);
    }

    private List<PublishLogEntry> append(List<PublishLogEntry> entries) {
        List<PublishLogEntry> merged = new ArrayList<>(publishLog);
        merged.addAll(entries);
        return merged;
    }
}

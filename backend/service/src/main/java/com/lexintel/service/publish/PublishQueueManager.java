package com.lexintel.service.publish;

import com.lexintel.core.bus.EventBus;
import com.lexintel.core.events.PostFailed;
import com.lexintel.core.events.PostPublished;
import com.lexintel.core.model.ArticleStatus;
import com.lexintel.core.model.PublishLogEntry;
import com.lexintel.core.model.PublishQueueItem;
import com.lexintel.core.model.PublishStatus;
import com.lexintel.core.model.Urgency;
import com.lexintel.service.config.PipelineConfig;
import com.lexintel.service.store.ArticleStore;
import com.lexintel.service.store.PublishQueueStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Owns every publish queue item from enqueue to a terminal state. Adapters only return
 * outcomes; all transitions are applied here through compare-and-set on the store, so
 * overlapping drains never publish the same item twice.
 */
public class PublishQueueManager {
    private static final Logger LOGGER = Logger.getLogger(PublishQueueManager.class.getName());

    private final PublishQueueStore queueStore;
    private final ArticleStore articleStore;
    private final Map<String, PlatformAdapter> adapters;
    private final BackoffPolicy backoff;
    private final PipelineConfig.Publish config;
    private final EventBus eventBus;
    private final Clock clock;
    private final ExecutorService executor;

    public PublishQueueManager(
            PublishQueueStore queueStore,
            ArticleStore articleStore,
            Map<String, PlatformAdapter> adapters,
            PipelineConfig.Publish config,
            EventBus eventBus,
            Clock clock,
            ExecutorService executor
    ) {
        this.queueStore = queueStore;
        this.articleStore = articleStore;
        this.adapters = Map.copyOf(adapters);
        this.backoff = new BackoffPolicy(config.backoffBase(), config.backoffMultiplier(), config.backoffCap());
        this.config = config;
        this.eventBus = eventBus;
        this.clock = clock;
        this.executor = executor;
    }

    public PublishQueueItem enqueue(
            String platform,
            String articleId,
            String briefingId,
            String title,
            String body,
            String fallbackBody,
            Urgency urgency,
            int maxRetries
    ) {
        PublishQueueItem item = PublishQueueItem.queued(
                UUID.randomUUID().toString(),
                queueStore.nextSequence(),
                platform,
                articleId,
                briefingId,
                title,
                body,
                fallbackBody,
                urgency,
                maxRetries,
                clock.instant()
        );
        queueStore.insert(item);
        LOGGER.fine(() -> "Queued " + item.id() + " for " + platform + " at priority " + item.priority());
        return item;
    }

    public Optional<PublishQueueItem> find(String id) {
        return queueStore.get(id);
    }

    public Optional<PublishQueueItem> skip(String id) {
        Optional<PublishQueueItem> skipped = queueStore.compareAndUpdate(
                id, item -> item.status().claimable(), PublishQueueItem::skipped);
        skipped.ifPresent(item -> LOGGER.info("Skipped queue item " + id + " for " + item.platform()));
        return skipped;
    }

    public int reclaimStale() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(config.claimLease());
        int reclaimed = 0;
        for (PublishQueueItem stale : queueStore.inStatus(PublishStatus.PUBLISHING)) {
            if (stale.claimedAt() == null || !stale.claimedAt().isBefore(cutoff)) {
                continue;
            }
            String token = stale.claimToken();
            Optional<PublishQueueItem> released = queueStore.completeClaim(
                    stale.id(),
                    token == null ? "" : token,
                    item -> item.released(List.of(PublishLogEntry.released(now, "claim lease expired"))));
            if (released.isPresent()) {
                reclaimed++;
                LOGGER.warning("Reclaimed stale publishing claim on " + stale.id() + " claimed at " + stale.claimedAt());
            }
        }
        return reclaimed;
    }

    public DrainReport drain() {
        return drain(Optional.empty());
    }

    public DrainReport drain(Optional<String> platform) {
        int reclaimed = reclaimStale();
        Tally tally = new Tally();
        for (PublishQueueItem candidate : queueStore.eligible(clock.instant())) {
            if (platform.isPresent() && !platform.get().equals(candidate.platform())) {
                continue;
            }
            if (tally.attempted >= config.drainLimit()) {
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                tally.interrupted = true;
                break;
            }
            PlatformAdapter adapter = adapters.get(candidate.platform());
            if (adapter == null) {
                tally.skippedNoAdapter++;
                continue;
            }
            String token = UUID.randomUUID().toString();
            Optional<PublishQueueItem> claimed = queueStore.claim(candidate.id(), token, clock.instant());
            if (claimed.isEmpty()) {
                tally.conflicts++;
                LOGGER.fine(() -> "Item " + candidate.id() + " was claimed elsewhere");
                continue;
            }
            tally.attempted++;
            tally.processedIds.add(candidate.id());
            if (!process(claimed.get(), token, adapter, tally)) {
                tally.interrupted = true;
                break;
            }
        }
        DrainReport report = new DrainReport(reclaimed, tally.attempted, tally.published, tally.viaFallback,
                tally.retried, tally.failed, tally.conflicts, tally.skippedNoAdapter, tally.interrupted,
                tally.processedIds);
        if (report.attempted() > 0 || report.reclaimed() > 0) {
            LOGGER.info("Drain: " + report.attempted() + " attempted, " + report.published() + " published, "
                    + report.retryQueued() + " retry queued, " + report.failed() + " failed");
        }
        return report;
    }

    /**
     * Runs one claimed attempt to completion. Returns false when the thread was
     * interrupted, after the claim has been released.
     */
    private boolean process(PublishQueueItem item, String token, PlatformAdapter adapter, Tally tally) {
        List<PublishLogEntry> entries = new ArrayList<>();
        PublishRequest primary = PublishRequest.primary(item);
        PublishOutcome outcome;
        try {
            outcome = invoke(adapter, primary);
        } catch (InterruptedException e) {
            release(item, token, "interrupted", entries);
            Thread.currentThread().interrupt();
            return false;
        }
        PublishRequest sent = primary;
        if (outcome instanceof PublishOutcome.Failed failed) {
            entries.add(PublishLogEntry.failed(clock.instant(), primary.variant(), failed.message()));
            if (failed.kind() == PublishOutcome.FailureKind.CONTENT && item.firstAttempt() && item.hasFallback()) {
                LOGGER.info("Content rejected for " + item.id() + " on " + item.platform() + ", trying fallback body");
                sent = PublishRequest.fallback(item);
                try {
                    outcome = invoke(adapter, sent);
                } catch (InterruptedException e) {
                    release(item, token, "interrupted", entries);
                    Thread.currentThread().interrupt();
                    return false;
                }
                if (outcome instanceof PublishOutcome.Failed fallbackFailed) {
                    entries.add(PublishLogEntry.failed(clock.instant(), sent.variant(), fallbackFailed.message()));
                }
            }
        }

        if (outcome instanceof PublishOutcome.Published published) {
            complete(item, token, sent, published, entries, tally);
        } else {
            fail(item, token, (PublishOutcome.Failed) outcome, entries, tally);
        }
        return true;
    }

    private PublishOutcome invoke(PlatformAdapter adapter, PublishRequest request) throws InterruptedException {
        Future<PublishOutcome> call = executor.submit(() -> adapter.publish(request));
        try {
            PublishOutcome outcome = call.get(config.publishTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return outcome == null ? PublishOutcome.transientFailure("Adapter returned no outcome") : outcome;
        } catch (TimeoutException e) {
            call.cancel(true);
            return PublishOutcome.transientFailure("Publish timed out after " + config.publishTimeout().toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOGGER.warning("Adapter " + adapter.platform() + " threw " + cause);
            return PublishOutcome.transientFailure("Adapter error: " + cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        }
    }

    private void complete(
            PublishQueueItem item,
            String token,
            PublishRequest sent,
            PublishOutcome.Published published,
            List<PublishLogEntry> entries,
            Tally tally
    ) {
        Instant now = clock.instant();
        entries.add(PublishLogEntry.published(now, sent.variant(), published.platformId()));
        Optional<PublishQueueItem> done = queueStore.completeClaim(
                item.id(), token, current -> current.published(now, published.platformId(), entries));
        if (done.isEmpty()) {
            tally.conflicts++;
            LOGGER.warning("Claim on " + item.id() + " was lost before publish of " + published.platformId()
                    + " could be recorded");
            return;
        }
        tally.published++;
        if (sent.fallbackVariant()) {
            tally.viaFallback++;
        }
        LOGGER.info("Published " + item.id() + " to " + item.platform() + " as " + published.platformId()
                + (sent.fallbackVariant() ? " using fallback body" : ""));
        markArticlePublished(item.articleId());
        eventBus.publish(new PostPublished(now, item.id(), item.platform(), published.platformId(),
                sent.fallbackVariant()));
    }

    private void fail(
            PublishQueueItem item,
            String token,
            PublishOutcome.Failed failure,
            List<PublishLogEntry> entries,
            Tally tally
    ) {
        Instant now = clock.instant();
        boolean retry = failure.retryable() && item.retryCount() < item.maxRetries();
        Optional<PublishQueueItem> next;
        if (retry) {
            Instant retryAt = backoff.nextRetryAt(now, item.retryCount(), failure.retryAfter());
            next = queueStore.completeClaim(item.id(), token,
                    current -> current.retryQueued(retryAt, entries, failure.message()));
        } else {
            next = queueStore.completeClaim(item.id(), token, current -> current.failed(entries, failure.message()));
        }
        if (next.isEmpty()) {
            tally.conflicts++;
            LOGGER.warning("Claim on " + item.id() + " was lost before its failure could be recorded");
            return;
        }
        if (retry) {
            tally.retried++;
            LOGGER.warning("Publish of " + item.id() + " to " + item.platform() + " failed ("
                    + failure.kind() + "), retry " + next.get().retryCount() + "/" + item.maxRetries()
                    + " at " + next.get().nextRetryAt() + ": " + failure.message());
        } else {
            tally.failed++;
            LOGGER.warning("Publish of " + item.id() + " to " + item.platform() + " failed permanently ("
                    + failure.kind() + "): " + failure.message());
        }
        eventBus.publish(new PostFailed(now, item.id(), item.platform(), !retry, failure.message()));
    }

    private void release(PublishQueueItem item, String token, String reason, List<PublishLogEntry> attempts) {
        Instant now = clock.instant();
        List<PublishLogEntry> entries = new ArrayList<>(attempts);
        entries.add(PublishLogEntry.released(now, reason));
        Optional<PublishQueueItem> released = queueStore.completeClaim(
                item.id(), token, current -> current.released(entries));
        if (released.isPresent()) {
            LOGGER.info("Released claim on " + item.id() + ": " + reason);
        } else {
            LOGGER.warning("Claim on " + item.id() + " was already gone when releasing: " + reason);
        }
    }

    private void markArticlePublished(String articleId) {
        if (articleId == null) {
            return;
        }
        articleStore.update(articleId, article -> article.status().canAdvanceTo(ArticleStatus.PUBLISHED)
                ? article.advanceTo(ArticleStatus.PUBLISHED)
                : article);
    }

    private static final class Tally {
        private int attempted;
        private int published;
        private int viaFallback;
        private int retried;
        private int failed;
        private int conflicts;
        private int skippedNoAdapter;
        private boolean interrupted;
        private final List<String> processedIds = new ArrayList<>();
    }
}

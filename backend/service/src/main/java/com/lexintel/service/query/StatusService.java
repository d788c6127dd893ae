package com.lexintel.service.query;

import com.lexintel.core.model.ArticleStatus;
import com.lexintel.core.model.PublishQueueItem;
import com.lexintel.core.model.PublishStatus;
import com.lexintel.core.model.ScrapeRun;
import com.lexintel.core.model.SourceHealth;
import com.lexintel.service.signals.SourceHealthReport;
import com.lexintel.service.store.ArticleStore;
import com.lexintel.service.store.PublishQueueStore;
import com.lexintel.service.store.RunStore;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class StatusService {
    static final int SOURCE_WINDOW_DAYS = 30;

    private final ArticleStore articleStore;
    private final PublishQueueStore queueStore;
    private final RunStore runStore;
    private final SourceHealthReport sourceHealth;
    private final Clock clock;

    public StatusService(
            ArticleStore articleStore,
            PublishQueueStore queueStore,
            RunStore runStore,
            SourceHealthReport sourceHealth,
            Clock clock
    ) {
        this.articleStore = articleStore;
        this.queueStore = queueStore;
        this.runStore = runStore;
        this.sourceHealth = sourceHealth;
        this.clock = clock;
    }

    public record Status(
            ScrapeRun latestRun,
            Map<ArticleStatus, Long> articles,
            Map<PublishStatus, Long> publishQueue,
            long failed,
            long publishedToday,
            List<SourceHealth> sources
    ) {
    }

    public Status status() {
        Map<PublishStatus, Long> queue = new LinkedHashMap<>(queueStore.countByStatus());
        Instant startOfDay = LocalDate.now(clock.withZone(ZoneOffset.UTC)).atStartOfDay(ZoneOffset.UTC).toInstant();
        long publishedToday = queueStore.inStatus(PublishStatus.PUBLISHED).stream()
                .map(PublishQueueItem::publishedAt)
                .filter(at -> at != null && !at.isBefore(startOfDay))
                .count();
        return new Status(
                runStore.latestScrapeRun().orElse(null),
                articleStore.countByStatus(),
                queue,
                queue.getOrDefault(PublishStatus.FAILED, 0L),
                publishedToday,
                sourceHealth.report(SOURCE_WINDOW_DAYS)
        );
    }
}

package com.lexintel.service.store;

import com.lexintel.core.model.PublishQueueItem;
import com.lexintel.core.model.PublishStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Durable queue state. All status changes go through {@link #compareAndUpdate}, which is
 * the single place where concurrent drains are serialized.
 */
public interface PublishQueueStore {
    Comparator<PublishQueueItem> DRAIN_ORDER = Comparator.comparingInt(PublishQueueItem::priority)
            .thenComparing(PublishQueueItem::createdAt)
            .thenComparingLong(PublishQueueItem::sequence);

    long nextSequence();

    void insert(PublishQueueItem item);

    Optional<PublishQueueItem> get(String id);

    List<PublishQueueItem> all();

    List<PublishQueueItem> inStatus(PublishStatus status);

    /**
     * Atomically replaces the item when {@code expected} holds for its current state.
     * Returns the new state, or empty when the item is missing or the guard failed.
     */
    Optional<PublishQueueItem> compareAndUpdate(
            String id,
            Predicate<PublishQueueItem> expected,
            UnaryOperator<PublishQueueItem> transition
    );

    Map<PublishStatus, Long> countByStatus();

    default List<PublishQueueItem> eligible(Instant now) {
        return all().stream()
                .filter(item -> item.eligibleAt(now))
                .sorted(DRAIN_ORDER)
                .toList();
    }

    default Optional<PublishQueueItem> claim(String id, String token, Instant now) {
        return compareAndUpdate(id, item -> item.eligibleAt(now), item -> item.claimed(token, now));
    }

    // Applies the outcome of an attempt only while token still owns the claim.
    default Optional<PublishQueueItem> completeClaim(
            String id,
            String token,
            UnaryOperator<PublishQueueItem> transition
    ) {
        return compareAndUpdate(
                id,
                item -> item.status() == PublishStatus.PUBLISHING && token.equals(item.claimToken()),
                transition
        );
    }
}

package com.lexintel.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lexintel.core.model.PublishQueueItem;
import com.lexintel.core.model.PublishStatus;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

public class JsonFilePublishQueueStore implements PublishQueueStore {
    private final JsonSnapshotFile<List<PublishQueueItem>> snapshot;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile Map<String, PublishQueueItem> items;
    private long sequence;

    public JsonFilePublishQueueStore(Path file) {
        this.snapshot = new JsonSnapshotFile<>(file, new TypeReference<>() {
        });
        Map<String, PublishQueueItem> loaded = new LinkedHashMap<>();
        for (PublishQueueItem item : snapshot.load(List::of)) {
            loaded.put(item.id(), item);
            sequence = Math.max(sequence, item.sequence());
        }
        this.items = loaded;
    }

    @Override
    public long nextSequence() {
        lock.lock();
        try {
            return ++sequence;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void insert(PublishQueueItem item) {
        lock.lock();
        try {
            if (items.containsKey(item.id())) {
                throw new IllegalStateException("Queue item already stored: " + item.id());
            }
            Map<String, PublishQueueItem> next = new LinkedHashMap<>(items);
            next.put(item.id(), item);
            commit(next);
            sequence = Math.max(sequence, item.sequence());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<PublishQueueItem> get(String id) {
        return Optional.ofNullable(items.get(id));
    }

    @Override
    public List<PublishQueueItem> all() {
        return List.copyOf(items.values());
    }

    @Override
    public List<PublishQueueItem> inStatus(PublishStatus status) {
        return items.values().stream()
                .filter(item -> item.status() == status)
                .sorted(DRAIN_ORDER)
                .toList();
    }

    @Override
    public Optional<PublishQueueItem> compareAndUpdate(
            String id,
            Predicate<PublishQueueItem> expected,
            UnaryOperator<PublishQueueItem> transition
    ) {
        lock.lock();
        try {
            PublishQueueItem current = items.get(id);
            if (current == null || !expected.test(current)) {
                return Optional.empty();
            }
            PublishQueueItem updated = transition.apply(current);
            Map<String, PublishQueueItem> next = new LinkedHashMap<>(items);
            next.put(id, updated);
            commit(next);
            return Optional.of(updated);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<PublishStatus, Long> countByStatus() {
        Map<PublishStatus, Long> counts = new EnumMap<>(PublishStatus.class);
        for (PublishStatus status : PublishStatus.values()) {
            counts.put(status, 0L);
        }
        for (PublishQueueItem item : items.values()) {
            counts.merge(item.status(), 1L, Long::sum);
        }
        return counts;
    }

    private void commit(Map<String, PublishQueueItem> next) {
        snapshot.write(new ArrayList<>(next.values()));
        items = next;
    }
}

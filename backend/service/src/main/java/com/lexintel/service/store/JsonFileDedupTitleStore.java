package com.lexintel.service.store;

import com.fasterxml.jackson.core.type.TypeReference;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

public class JsonFileDedupTitleStore implements DedupTitleStore {
    private final JsonSnapshotFile<List<DedupTitle>> snapshot;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile List<DedupTitle> titles;

    public JsonFileDedupTitleStore(Path file) {
        this.snapshot = new JsonSnapshotFile<>(file, new TypeReference<>() {
        });
        this.titles = List.copyOf(snapshot.load(List::of));
    }

    @Override
    public void add(DedupTitle title) {
        lock.lock();
        try {
            List<DedupTitle> next = new ArrayList<>(titles);
            next.removeIf(existing -> existing.titleNorm().equals(title.titleNorm()));
            next.add(title);
            commit(next);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean seenSince(String titleNorm, Instant since) {
        return titles.stream()
                .anyMatch(title -> title.titleNorm().equals(titleNorm) && !title.seenAt().isBefore(since));
    }

    @Override
    public List<DedupTitle> seenSince(Instant since) {
        return titles.stream()
                .filter(title -> !title.seenAt().isBefore(since))
                .sorted(Comparator.comparing(DedupTitle::seenAt))
                .toList();
    }

    @Override
    public int pruneBefore(Instant cutoff) {
        lock.lock();
        try {
            List<DedupTitle> next = new ArrayList<>(titles);
            int before = next.size();
            next.removeIf(title -> title.seenAt().isBefore(cutoff));
            int removed = before - next.size();
            if (removed > 0) {
                commit(next);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private void commit(List<DedupTitle> next) {
        snapshot.write(next);
        titles = List.copyOf(next);
    }
}

package com.lexintel.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lexintel.core.model.AnalysisRun;
import com.lexintel.core.model.Briefing;
import com.lexintel.core.model.ScrapeRun;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

public class JsonFileRunStore implements RunStore {
    private final JsonSnapshotFile<RunHistory> snapshot;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile RunHistory history;

    public JsonFileRunStore(Path file) {
        this.snapshot = new JsonSnapshotFile<>(file, new TypeReference<>() {
        });
        this.history = snapshot.load(RunHistory::empty);
    }

    @Override
    public void saveScrapeRun(ScrapeRun run) {
        lock.lock();
        try {
            List<ScrapeRun> runs = new ArrayList<>(history.scrapeRuns());
            runs.removeIf(existing -> existing.id().equals(run.id()));
            runs.add(run);
            commit(new RunHistory(runs, history.analysisRuns(), history.briefings()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ScrapeRun> scrapeRuns() {
        return history.scrapeRuns().stream()
                .sorted(Comparator.comparing(ScrapeRun::startedAt).reversed())
                .toList();
    }

    @Override
    public Optional<ScrapeRun> latestScrapeRun() {
        return scrapeRuns().stream().findFirst();
    }

    @Override
    public void saveAnalysisRun(AnalysisRun run) {
        lock.lock();
        try {
            List<AnalysisRun> runs = new ArrayList<>(history.analysisRuns());
            runs.add(run);
            commit(new RunHistory(history.scrapeRuns(), runs, history.briefings()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<AnalysisRun> analysisRuns() {
        return history.analysisRuns().stream()
                .sorted(Comparator.comparing(AnalysisRun::startedAt).reversed())
                .toList();
    }

    @Override
    public void saveBriefing(Briefing briefing) {
        lock.lock();
        try {
            List<Briefing> briefings = new ArrayList<>(history.briefings());
            briefings.add(briefing);
            commit(new RunHistory(history.scrapeRuns(), history.analysisRuns(), briefings));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Briefing> latestBriefing() {
        return history.briefings().stream().max(Comparator.comparing(Briefing::createdAt));
    }

    @Override
    public List<Briefing> briefingsOn(LocalDate date) {
        return history.briefings().stream()
                .filter(briefing -> briefing.createdAt().atZone(ZoneOffset.UTC).toLocalDate().equals(date))
                .sorted(Comparator.comparing(Briefing::createdAt).reversed())
                .toList();
    }

    private void commit(RunHistory next) {
        snapshot.write(next);
        history = next;
    }

    record RunHistory(List<ScrapeRun> scrapeRuns, List<AnalysisRun> analysisRuns, List<Briefing> briefings) {
        RunHistory {
            scrapeRuns = scrapeRuns == null ? List.of() : List.copyOf(scrapeRuns);
            analysisRuns = analysisRuns == null ? List.of() : List.copyOf(analysisRuns);
            briefings = briefings == null ? List.of() : List.copyOf(briefings);
        }

        static RunHistory empty() {
            return new RunHistory(List.of(), List.of(), List.of());
        }
    }
}

package com.lexintel.service.store;

import com.lexintel.core.model.AnalysisRun;
import com.lexintel.core.model.Briefing;
import com.lexintel.core.model.ScrapeRun;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface RunStore {
    void saveScrapeRun(ScrapeRun run);

    List<ScrapeRun> scrapeRuns();

    Optional<ScrapeRun> latestScrapeRun();

    void saveAnalysisRun(AnalysisRun run);

    List<AnalysisRun> analysisRuns();

    void saveBriefing(Briefing briefing);

    Optional<Briefing> latestBriefing();

    List<Briefing> briefingsOn(LocalDate date);
}

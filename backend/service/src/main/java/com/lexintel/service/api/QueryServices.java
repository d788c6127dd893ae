package com.lexintel.service.api;

import com.lexintel.service.query.ArticleSearch;
import com.lexintel.service.query.StatusService;
import com.lexintel.service.signals.MomentumCalculator;
import com.lexintel.service.signals.SignalClusterer;
import com.lexintel.service.signals.SourceHealthReport;
import com.lexintel.service.store.EventStore;
import com.lexintel.service.store.RunStore;

public record QueryServices(
        ArticleSearch articleSearch,
        RunStore runStore,
        SignalClusterer signalClusterer,
        MomentumCalculator momentumCalculator,
        SourceHealthReport sourceHealth,
        StatusService statusService,
        EventStore eventStore,
        int defaultMinRelevance
) {
}

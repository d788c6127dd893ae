package com.lexintel.collectors.config;

import java.util.List;

public record SourcesConfig(int maxItemsPerSource, List<RssSourceConfig> sources) {
    public static final int DEFAULT_MAX_ITEMS = 50;

    public SourcesConfig {
        if (maxItemsPerSource <= 0) {
            maxItemsPerSource = DEFAULT_MAX_ITEMS;
        }
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}

package com.lexintel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lexintel.collectors.config.SourcesConfig;
import com.lexintel.core.model.CycleConfig;
import com.lexintel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static List<CycleConfig> loadCycles(Path configDir) {
        List<CycleConfig> cycles = read(configDir.resolve("cycles.json"), new TypeReference<>() {
        });
        for (CycleConfig cycle : cycles) {
            if (cycle.name() == null || cycle.name().isBlank()) {
                throw new IllegalStateException("Cycle without a name in " + configDir.resolve("cycles.json"));
            }
        }
        return cycles;
    }

    public static SourcesConfig loadSources(Path configDir) {
        Path path = configDir.resolve("sources.json");
        SourcesConfig sources = read(path, new TypeReference<>() {
        });
        sources.sources().forEach(source -> {
            if (source.source() == null || source.source().isBlank() || source.url() == null || source.url().isBlank()) {
                throw new IllegalStateException("Source entries need both source and url in " + path);
            }
        });
        return sources;
    }

    public static PipelineConfig loadPipeline(Path configDir) {
        Path path = configDir.resolve("pipeline.json");
        if (!Files.exists(path)) {
            return PipelineConfig.defaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}

package com.lexintel.service.config;

import com.lexintel.collectors.config.SourcesConfig;
import com.lexintel.core.model.CycleConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsAllServiceConfigs() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("cycles.json"), """
                [
                  {"name":"scrape","enabled":true,"intervalSeconds":86400},
                  {"name":"cycle","enabled":false,"intervalSeconds":3600}
                ]
                """);
        Files.writeString(dir.resolve("sources.json"), """
                {
                  "maxItemsPerSource":20,
                  "sources":[{"source":"36kr","url":"https://36kr.com/feed"}]
                }
                """);
        Files.writeString(dir.resolve("pipeline.json"), """
                {
                  "dedup":{"semanticThreshold":0.9},
                  "publish":{
                    "platforms":[{"name":"devto","format":"long","maxRetries":1},{"name":"x","format":"short"}],
                    "backoffBase":"PT1M"
                  }
                }
                """);

        List<CycleConfig> cycles = ConfigLoader.loadCycles(dir);
        SourcesConfig sources = ConfigLoader.loadSources(dir);
        PipelineConfig pipeline = ConfigLoader.loadPipeline(dir);

        assertEquals(2, cycles.size());
        assertEquals("scrape", cycles.get(0).name());
        assertFalse(cycles.get(1).enabled());
        assertEquals(20, sources.maxItemsPerSource());
        assertEquals("36kr", sources.sources().get(0).source());

        assertEquals(0.9, pipeline.dedup().semanticThreshold());
        assertEquals(500, pipeline.dedup().windowSize());
        assertEquals(Duration.ofMinutes(1), pipeline.publish().backoffBase());
        assertEquals(Duration.ofHours(6), pipeline.publish().backoffCap());
        assertEquals(PlatformConfig.Format.SHORT, pipeline.publish().platforms().get(1).format());
        assertEquals(0, pipeline.publish().platforms().get(1).maxRetries());
        assertEquals(50, pipeline.analysis().batchSize());
    }

    @Test
    void missingPipelineFileMeansDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-defaults-");

        PipelineConfig pipeline = ConfigLoader.loadPipeline(dir);

        assertEquals(0.85, pipeline.dedup().semanticThreshold());
        assertEquals(PlatformConfig.defaults(), pipeline.publish().platforms());
        assertEquals(20, pipeline.publish().drainLimit());
        assertEquals(90, pipeline.maintenance().archiveAfterDays());
    }

    @Test
    void missingOrInvalidConfigFailsFastWithPathInMessage() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-invalid-");
        Files.writeString(dir.resolve("cycles.json"), "{not-json");
        Files.writeString(dir.resolve("pipeline.json"), """
                {"publish":{"platforms":[{"format":"long"}]}}
                """);

        IllegalStateException invalid = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadCycles(dir));
        assertTrue(invalid.getMessage().contains("cycles.json"));

        IllegalStateException missing = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadSources(dir));
        assertTrue(missing.getMessage().contains("sources.json"));

        IllegalStateException unnamed = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadPipeline(dir));
        assertTrue(unnamed.getMessage().contains("pipeline.json"));
    }

    @Test
    void sourceWithoutUrlIsRejected() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-sources-");
        Files.writeString(dir.resolve("sources.json"), """
                {"sources":[{"source":"36kr"}]}
                """);

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadSources(dir));
        assertTrue(error.getMessage().contains("source and url"));
    }
}

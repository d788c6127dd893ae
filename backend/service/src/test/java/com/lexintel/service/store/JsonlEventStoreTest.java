package com.lexintel.service.store;

import com.lexintel.core.events.AlertRaised;
import com.lexintel.core.events.CycleStarted;
import com.lexintel.core.events.Event;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlEventStoreTest {
    private static final Instant T0 = Instant.parse("2026-03-02T06:00:00Z");

    @Test
    void roundTripAppendsAndReloadsEvents() throws Exception {
        Path file = Files.createTempDirectory("event-store-roundtrip-").resolve("logs/events.jsonl");

        new JsonlEventStore(file).append(alert("first", T0));

        List<Event> events = new JsonlEventStore(file).query(Instant.EPOCH, Optional.empty(), 10);
        assertEquals(1, events.size());
        assertEquals("AlertRaised", events.get(0).type());
    }

    @Test
    void querySupportsSinceTypeAndLimit() throws Exception {
        JsonlEventStore store = new JsonlEventStore(Files.createTempDirectory("event-store-query-").resolve("events.jsonl"));
        for (int i = 0; i < 5; i++) {
            store.append(alert("a" + i, T0.plusSeconds(i)));
            store.append(new CycleStarted(T0.plusSeconds(i), "scrape"));
        }

        List<Event> newestAlerts = store.query(T0.plusSeconds(1), Optional.of("AlertRaised"), 2);

        assertEquals(2, newestAlerts.size());
        assertEquals("a3", ((AlertRaised) newestAlerts.get(0)).message());
        assertEquals("a4", ((AlertRaised) newestAlerts.get(1)).message());
        assertEquals(8, store.query(T0.plusSeconds(1), Optional.empty(), 100).size());
    }

    @Test
    void undecodableLinesAreSkipped() throws Exception {
        Path file = Files.createTempDirectory("event-store-torn-").resolve("events.jsonl");
        JsonlEventStore store = new JsonlEventStore(file);
        store.append(alert("before", T0));
        Files.writeString(file, "{\"type\":\"AlertRai\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        store.append(alert("after", T0.plusSeconds(1)));

        List<Event> events = store.query(Instant.EPOCH, Optional.empty(), 10);

        assertEquals(2, events.size());
        assertEquals("after", ((AlertRaised) events.get(1)).message());
    }

    @Test
    void missingFileQueriesAsEmpty() throws Exception {
        JsonlEventStore store = new JsonlEventStore(Files.createTempDirectory("event-store-missing-").resolve("none.jsonl"));

        assertTrue(store.query(Instant.EPOCH, Optional.empty(), 10).isEmpty());
    }

    @Test
    void concurrentAppendsProduceWholeLines() throws Exception {
        Path file = Files.createTempDirectory("event-store-concurrent-").resolve("events.jsonl");
        JsonlEventStore store = new JsonlEventStore(file);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> writes = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                int n = i;
                writes.add(pool.submit(() -> store.append(alert("e" + n, T0.plusSeconds(n)))));
            }
            for (Future<?> write : writes) {
                write.get();
            }
        } finally {
            pool.shutdownNow();
        }

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(40, lines.size());
        for (String line : lines) {
            assertEquals("AlertRaised", EventCodec.fromJsonLine(line).type());
        }
    }

    private static AlertRaised alert(String message, Instant at) {
        return new AlertRaised(at, "cycle", message, Map.of("cycle", "scrape"));
    }
}

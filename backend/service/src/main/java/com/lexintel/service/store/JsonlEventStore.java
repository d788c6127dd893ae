package com.lexintel.service.store;

import com.lexintel.core.events.Event;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Append-only JSONL event log. A line that cannot be decoded (torn write after a crash,
 * or an event type this build no longer knows) is skipped and logged.
 */
public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this.file = file;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        int bounded = Math.max(1, limit);
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            Deque<Event> newest = new ArrayDeque<>(Math.min(bounded, 1024));
            int lineNumber = 0;
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    Optional<Event> decoded = decode(line, lineNumber);
                    if (decoded.isEmpty()) {
                        continue;
                    }
                    Event event = decoded.get();
                    if (event.timestamp().isBefore(since)) {
                        continue;
                    }
                    if (type.isPresent() && !type.get().equals(event.type())) {
                        continue;
                    }
                    if (newest.size() == bounded) {
                        newest.removeFirst();
                    }
                    newest.addLast(event);
                }
            }
            return new ArrayList<>(newest);
        } catch (IOException e) {
            throw new IllegalStateException("Failed querying events from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private Optional<Event> decode(String line, int lineNumber) {
        try {
            return Optional.of(EventCodec.fromJsonLine(line));
        } catch (RuntimeException decodeError) {
            LOGGER.warning("Skipping undecodable event at " + file + ":" + lineNumber + " - " + decodeError.getMessage());
            return Optional.empty();
        }
    }
}

package com.lexintel.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexintel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;

/**
 * Whole-file JSON persistence for one store. Writes go to a sibling temp file that is
 * then moved over the target, so a failed write leaves the previous snapshot intact.
 */
final class JsonSnapshotFile<T> {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final TypeReference<T> type;

    JsonSnapshotFile(Path file, TypeReference<T> type) {
        this.file = file;
        this.type = type;
    }

    T load(Supplier<T> empty) {
        if (!Files.exists(file)) {
            return empty.get();
        }
        try (InputStream in = Files.newInputStream(file)) {
            T loaded = MAPPER.readValue(in, type);
            return loaded == null ? empty.get() : loaded;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading snapshot from " + file, e);
        }
    }

    void write(T snapshot) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, snapshot);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing snapshot to " + file, e);
        }
    }

    Path file() {
        return file;
    }
}
